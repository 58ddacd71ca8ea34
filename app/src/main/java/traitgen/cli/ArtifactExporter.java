package traitgen.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import traitgen.core.model.Artifact;
import traitgen.generation.GenerationListener;
import traitgen.generation.ItemFailure;
import traitgen.generation.Progress;

/**
 * Writes delivered artifacts into a staging directory next to the target and moves the whole tree
 * into place once the run has ended, so a failed run never leaves a half-written output directory.
 */
final class ArtifactExporter implements GenerationListener {
  private static final Logger LOG = LoggerFactory.getLogger(ArtifactExporter.class);
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  private final Path targetDir;
  private final Path stagingDir;
  private int written;

  private ArtifactExporter(Path targetDir, Path stagingDir) {
    this.targetDir = targetDir;
    this.stagingDir = stagingDir;
  }

  static ArtifactExporter open(Path outputDir) throws IOException {
    Path targetDir = outputDir.toAbsolutePath().normalize();
    Path parent = targetDir.getParent() == null ? targetDir : targetDir.getParent();
    Files.createDirectories(parent);
    String prefix =
        targetDir.getFileName() != null ? targetDir.getFileName().toString() + "-" : "traitgen-";
    Path stagingDir = Files.createTempDirectory(parent, prefix);
    Files.createDirectories(stagingDir.resolve("images"));
    Files.createDirectories(stagingDir.resolve("metadata"));
    return new ArtifactExporter(targetDir, stagingDir);
  }

  int written() {
    return written;
  }

  @Override
  public void onArtifacts(List<Artifact> artifacts) {
    try {
      for (Artifact artifact : artifacts) {
        Path image = stagingDir.resolve("images").resolve(artifact.imageName());
        Files.write(image, artifact.imageData());
        Files.writeString(
            stagingDir.resolve("metadata").resolve(artifact.metadataName()),
            GSON.toJson(artifact.metadata()));
        written++;
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write artifacts to " + stagingDir, e);
    }
  }

  @Override
  public void onProgress(Progress progress) {
    LOG.info("{}", progress.status());
  }

  @Override
  public void onItemFailed(ItemFailure failure) {
    LOG.warn("Item {} skipped: {}", failure.index() + 1, failure.message());
  }

  /** Writes the report and moves the staged tree over the target directory. */
  void commit(String reportJson) throws IOException {
    Files.writeString(stagingDir.resolve("report.json"), reportJson);
    deleteRecursively(targetDir);
    try {
      Files.move(stagingDir, targetDir, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(stagingDir, targetDir, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  void discard() throws IOException {
    deleteRecursively(stagingDir);
  }

  private static void deleteRecursively(Path path) throws IOException {
    if (path == null || !Files.exists(path)) {
      return;
    }
    Files.walkFileTree(
        path,
        new SimpleFileVisitor<>() {
          @Override
          public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
              throws IOException {
            Files.deleteIfExists(file);
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
            Files.deleteIfExists(dir);
            return FileVisitResult.CONTINUE;
          }
        });
  }
}
