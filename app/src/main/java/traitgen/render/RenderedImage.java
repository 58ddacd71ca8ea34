package traitgen.render;

import java.util.List;
import traitgen.core.model.Attribute;
import traitgen.core.model.OutputFormat;

/** Encoded composite plus the attribute list it was built from. */
public record RenderedImage(byte[] data, OutputFormat format, List<Attribute> attributes) {

  public RenderedImage {
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
  }
}
