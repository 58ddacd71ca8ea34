package traitgen.core;

import java.util.List;

/** The supplied layer catalog or uniqueness configuration is malformed. */
public final class CatalogValidationException extends GenerationException {
  private final List<String> problems;

  public CatalogValidationException(List<String> problems) {
    super(ErrorCode.INVALID_CATALOG, "Invalid catalog: " + String.join("; ", problems));
    this.problems = List.copyOf(problems);
  }

  public List<String> problems() {
    return problems;
  }
}
