package traitgen.core.model;

import com.google.gson.JsonObject;
import java.util.List;
import java.util.Objects;

/**
 * One rendered composite with its attribute record. Ownership of {@code imageData} passes to the
 * receiver on emission; the generator keeps no reference.
 */
public record Artifact(
    int index,
    String imageName,
    byte[] imageData,
    OutputFormat format,
    String metadataName,
    JsonObject metadata,
    List<Attribute> attributes,
    Assignment assignment) {

  public Artifact {
    Objects.requireNonNull(imageName, "imageName");
    Objects.requireNonNull(imageData, "imageData");
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(metadataName, "metadataName");
    Objects.requireNonNull(metadata, "metadata");
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
    Objects.requireNonNull(assignment, "assignment");
  }

  public static String imageName(int index, OutputFormat format) {
    return (index + 1) + "." + format.extension();
  }

  public static String metadataName(int index) {
    return (index + 1) + ".json";
  }

  @Override
  public String toString() {
    return "Artifact[" + imageName + ", " + imageData.length + " bytes, " + assignment + "]";
  }
}
