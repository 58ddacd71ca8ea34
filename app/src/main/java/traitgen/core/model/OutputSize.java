package traitgen.core.model;

/** Target pixel dimensions of every rendered artifact. */
public record OutputSize(int width, int height) {

  public OutputSize {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("output size must be positive: " + width + "x" + height);
    }
  }

  public long pixelCount() {
    return (long) width * height;
  }
}
