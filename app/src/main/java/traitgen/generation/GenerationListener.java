package traitgen.generation;

import java.util.List;
import traitgen.core.model.Artifact;

/**
 * Receives the non-terminal output of one run, in index order. Streaming runs deliver single
 * artifacts; chunked runs deliver one list per chunk.
 */
public interface GenerationListener {

  void onArtifacts(List<Artifact> artifacts);

  default void onProgress(Progress progress) {}

  default void onPreview(Preview preview) {}

  default void onItemFailed(ItemFailure failure) {}
}
