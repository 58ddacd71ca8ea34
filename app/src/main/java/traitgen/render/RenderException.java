package traitgen.render;

import traitgen.core.ErrorCode;
import traitgen.core.GenerationException;

/**
 * Decoding or encoding one artifact failed. A non-transient failure names the trait whose payload
 * can never be decoded; the run excludes it instead of retrying.
 */
public final class RenderException extends GenerationException {
  private final Integer traitId;
  private final boolean transientFailure;

  public RenderException(
      String message, Integer traitId, boolean transientFailure, Throwable cause) {
    super(ErrorCode.RENDER_FAILED, message, cause);
    this.traitId = traitId;
    this.transientFailure = transientFailure;
  }

  public static RenderException unreadable(int traitId, String message, Throwable cause) {
    return new RenderException(message, traitId, false, cause);
  }

  public static RenderException transientFailure(String message, Throwable cause) {
    return new RenderException(message, null, true, cause);
  }

  /** Offending trait id, or {@code null} when the failure is not tied to one payload. */
  public Integer traitId() {
    return traitId;
  }

  public boolean transientFailure() {
    return transientFailure;
  }
}
