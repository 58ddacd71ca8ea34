package traitgen.worker;

import java.util.List;
import traitgen.core.ErrorCode;
import traitgen.core.model.Artifact;
import traitgen.generation.ItemFailure;
import traitgen.generation.Preview;
import traitgen.generation.Progress;
import traitgen.generation.RunStats;

/** Messages a worker emits. Terminal events end a task: complete, error and cancelled. */
public interface WorkerEvent {

  /** Task the event belongs to, or {@code null} for control replies. */
  default String taskId() {
    return null;
  }

  default boolean terminal() {
    return false;
  }

  record Ready() implements WorkerEvent {}

  record Pong(long id) implements WorkerEvent {}

  record ProgressEvent(String taskId, Progress progress) implements WorkerEvent {}

  record PreviewEvent(String taskId, Preview preview) implements WorkerEvent {}

  record ItemFailedEvent(String taskId, ItemFailure failure) implements WorkerEvent {}

  /** One streamed artifact or one flushed chunk, in index order. */
  record Artifacts(String taskId, List<Artifact> artifacts) implements WorkerEvent {}

  record Complete(String taskId, int generated, int requested, RunStats stats)
      implements WorkerEvent {
    @Override
    public boolean terminal() {
      return true;
    }
  }

  record Error(String taskId, ErrorCode code, boolean recoverable, String message, int generated)
      implements WorkerEvent {
    @Override
    public boolean terminal() {
      return true;
    }
  }

  record Cancelled(String taskId, int generated, int requested) implements WorkerEvent {
    @Override
    public boolean terminal() {
      return true;
    }
  }
}
