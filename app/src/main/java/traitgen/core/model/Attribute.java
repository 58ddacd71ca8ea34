package traitgen.core.model;

import java.util.Objects;

/** One (layer name, trait name) pair of an artifact's attribute list. */
public record Attribute(String traitType, String value) {

  public Attribute {
    Objects.requireNonNull(traitType, "traitType");
    Objects.requireNonNull(value, "value");
  }
}
