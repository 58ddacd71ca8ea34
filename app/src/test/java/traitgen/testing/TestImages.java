package traitgen.testing;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import javax.imageio.ImageIO;

/** Small encoded images used as trait payloads. */
public final class TestImages {
  private TestImages() {}

  /** Opaque square of {@code color} with a transparent border, encoded as PNG. */
  public static byte[] png(Color color, int size) {
    BufferedImage image = new BufferedImage(size, size, BufferedImage.TYPE_INT_ARGB);
    Graphics2D g = image.createGraphics();
    try {
      g.setColor(color);
      g.fillRect(size / 4, size / 4, size / 2, size / 2);
    } finally {
      g.dispose();
    }
    return encode(image, "png");
  }

  public static byte[] jpeg(Color color, int size) {
    BufferedImage image = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = image.createGraphics();
    try {
      g.setColor(color);
      g.fillRect(0, 0, size, size);
    } finally {
      g.dispose();
    }
    return encode(image, "jpeg");
  }

  /** Bytes that start like a PNG but cannot be decoded. */
  public static byte[] corruptPng() {
    return new byte[] {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 0, 0, 0, 0};
  }

  private static byte[] encode(BufferedImage image, String format) {
    try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      if (!ImageIO.write(image, format, out)) {
        throw new IllegalStateException("No ImageIO writer for " + format);
      }
      return out.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
