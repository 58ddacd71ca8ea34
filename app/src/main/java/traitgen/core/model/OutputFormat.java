package traitgen.core.model;

/** Encoded artifact formats. */
public enum OutputFormat {
  PNG("png", "image/png", true),
  JPEG("jpg", "image/jpeg", false);

  private final String extension;
  private final String mimeType;
  private final boolean lossless;

  OutputFormat(String extension, String mimeType, boolean lossless) {
    this.extension = extension;
    this.mimeType = mimeType;
    this.lossless = lossless;
  }

  public String extension() {
    return extension;
  }

  public String mimeType() {
    return mimeType;
  }

  public boolean lossless() {
    return lossless;
  }

  /** ImageIO writer format name. */
  public String writerName() {
    return this == PNG ? "png" : "jpeg";
  }
}
