package traitgen.core;

import java.util.List;
import java.util.Objects;
import traitgen.core.model.Layer;
import traitgen.core.model.OutputSize;
import traitgen.core.model.UniquenessConfig;
import traitgen.metadata.MetadataStandard;

/** Everything the core consumes for one run. */
public record GenerationRequest(
    List<Layer> layers,
    int count,
    OutputSize outputSize,
    String projectName,
    String projectDescription,
    UniquenessConfig uniqueness,
    MetadataStandard metadataStandard) {

  public GenerationRequest {
    layers = layers == null ? List.of() : List.copyOf(layers);
    if (count < 0) {
      throw new IllegalArgumentException("count must be non-negative: " + count);
    }
    Objects.requireNonNull(outputSize, "outputSize");
    projectName = projectName == null ? "" : projectName;
    projectDescription = projectDescription == null ? "" : projectDescription;
    uniqueness = uniqueness == null ? UniquenessConfig.disabled() : uniqueness;
    metadataStandard = metadataStandard == null ? MetadataStandard.ERC721 : metadataStandard;
  }

  public static GenerationRequest of(
      List<Layer> layers, int count, OutputSize outputSize, UniquenessConfig uniqueness) {
    return new GenerationRequest(
        layers, count, outputSize, "Collection", "", uniqueness, MetadataStandard.ERC721);
  }

  public GenerationRequest withCount(int newCount) {
    return new GenerationRequest(
        layers,
        newCount,
        outputSize,
        projectName,
        projectDescription,
        uniqueness,
        metadataStandard);
  }
}
