package traitgen.cli;

import java.nio.file.Path;
import java.util.Objects;
import traitgen.metadata.MetadataStandard;
import traitgen.solver.CandidateOrdering;

record CliOptions(
    Path catalogFile,
    Path outputDir,
    int count,
    int width,
    int height,
    String projectName,
    String projectDescription,
    MetadataStandard standard,
    int workers,
    Long seed,
    CandidateOrdering ordering) {

  CliOptions {
    Objects.requireNonNull(catalogFile, "catalogFile");
    Objects.requireNonNull(outputDir, "outputDir");
    if (count < 0) {
      throw new IllegalArgumentException("count must be non-negative");
    }
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("output size must be positive");
    }
    standard = standard == null ? MetadataStandard.ERC721 : standard;
    ordering = ordering == null ? CandidateOrdering.RARITY_FIRST : ordering;
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private Path catalogFile;
    private Path outputDir;
    private Integer count;
    private int width = 512;
    private int height = 512;
    private String projectName;
    private String projectDescription;
    private MetadataStandard standard = MetadataStandard.ERC721;
    private int workers;
    private Long seed;
    private CandidateOrdering ordering = CandidateOrdering.RARITY_FIRST;

    Builder catalogFile(Path catalogFile) {
      this.catalogFile = catalogFile;
      return this;
    }

    Builder outputDir(Path outputDir) {
      this.outputDir = outputDir;
      return this;
    }

    Builder count(int count) {
      this.count = count;
      return this;
    }

    Builder size(int width, int height) {
      this.width = width;
      this.height = height;
      return this;
    }

    Builder projectName(String projectName) {
      this.projectName = projectName;
      return this;
    }

    Builder projectDescription(String projectDescription) {
      this.projectDescription = projectDescription;
      return this;
    }

    Builder standard(MetadataStandard standard) {
      this.standard = standard;
      return this;
    }

    Builder workers(int workers) {
      this.workers = workers;
      return this;
    }

    Builder seed(Long seed) {
      this.seed = seed;
      return this;
    }

    Builder ordering(CandidateOrdering ordering) {
      this.ordering = ordering;
      return this;
    }

    CliOptions build() {
      if (catalogFile == null) {
        throw new IllegalArgumentException("Missing --catalog");
      }
      if (count == null) {
        throw new IllegalArgumentException("Missing --count");
      }
      if (outputDir == null) {
        throw new IllegalArgumentException("Missing --out");
      }
      return new CliOptions(
          catalogFile,
          outputDir,
          count,
          width,
          height,
          projectName,
          projectDescription,
          standard,
          workers,
          seed,
          ordering);
    }
  }
}
