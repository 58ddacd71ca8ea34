package traitgen.core;

import java.util.Objects;

/** Base class of the generation failures that surface to callers. */
public class GenerationException extends RuntimeException {
  private final ErrorCode code;

  public GenerationException(ErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
  }

  public GenerationException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
  }

  public ErrorCode code() {
    return code;
  }
}
