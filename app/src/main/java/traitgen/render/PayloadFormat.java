package traitgen.render;

/** Source image container of a trait payload, identified by its magic bytes. */
public enum PayloadFormat {
  PNG(true),
  JPEG(false),
  GIF(true),
  WEBP_LOSSLESS(true),
  WEBP_LOSSY(false),
  BMP(true),
  TIFF(true),
  UNKNOWN(false);

  private final boolean lossless;

  PayloadFormat(boolean lossless) {
    this.lossless = lossless;
  }

  public boolean lossless() {
    return lossless;
  }

  public static PayloadFormat detect(byte[] data) {
    if (data == null || data.length < 2) {
      return UNKNOWN;
    }
    if (startsWith(data, 0xFF, 0xD8, 0xFF)) {
      return JPEG;
    }
    if (startsWith(data, 0x89, 0x50, 0x4E, 0x47)) {
      return PNG;
    }
    if (startsWith(data, 0x47, 0x49, 0x46)) {
      return GIF;
    }
    if (startsWith(data, 0x52, 0x49, 0x46, 0x46)
        && data.length >= 16
        && matches(data, 8, 0x57, 0x45, 0x42, 0x50)) {
      // chunk tag after the RIFF header: VP8L is lossless, VP8 and VP8X are treated as lossy
      return matches(data, 12, 0x56, 0x50, 0x38, 0x4C) ? WEBP_LOSSLESS : WEBP_LOSSY;
    }
    if (startsWith(data, 0x42, 0x4D)) {
      return BMP;
    }
    if (startsWith(data, 0x49, 0x49, 0x2A) || startsWith(data, 0x4D, 0x4D, 0x2A)) {
      return TIFF;
    }
    return UNKNOWN;
  }

  private static boolean startsWith(byte[] data, int... prefix) {
    return matches(data, 0, prefix);
  }

  private static boolean matches(byte[] data, int offset, int... expected) {
    if (data.length < offset + expected.length) {
      return false;
    }
    for (int i = 0; i < expected.length; i++) {
      if ((data[offset + i] & 0xFF) != expected[i]) {
        return false;
      }
    }
    return true;
  }
}
