package traitgen.render;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import traitgen.core.model.Assignment;
import traitgen.core.model.Attribute;
import traitgen.core.model.Catalog;
import traitgen.core.model.Layer;
import traitgen.core.model.OutputFormat;
import traitgen.core.model.OutputSize;
import traitgen.core.model.Trait;

/**
 * Renders assignments onto one reused surface, back to front in stacking order with plain overlay.
 *
 * <p>The output is PNG when any composited payload was itself lossless, otherwise JPEG at the
 * configured quality. One instance belongs to one run and is not thread-safe.
 */
public final class CompositionPipeline {
  private final Catalog catalog;
  private final OutputSize size;
  private final TraitDecoder decoder;
  private final float lossyQuality;
  private final BufferedImage surface;

  public CompositionPipeline(
      Catalog catalog, OutputSize size, TraitDecoder decoder, float lossyQuality) {
    this.catalog = catalog;
    this.size = size;
    this.decoder = decoder;
    this.lossyQuality = lossyQuality;
    this.surface = new BufferedImage(size.width(), size.height(), BufferedImage.TYPE_INT_ARGB);
  }

  public RenderedImage render(Assignment assignment) {
    clearSurface();
    boolean lossless = false;
    List<Attribute> attributes = new ArrayList<>(assignment.size());
    Graphics2D g2 = surface.createGraphics();
    try {
      g2.setComposite(AlphaComposite.SrcOver);
      for (Layer layer : catalog.layers()) {
        Trait trait = assignment.traitFor(layer.id());
        if (trait == null) {
          continue;
        }
        g2.drawImage(decoder.decode(trait), 0, 0, null);
        lossless |= PayloadFormat.detect(trait.payload()).lossless();
        attributes.add(new Attribute(layer.name(), trait.name()));
      }
    } finally {
      g2.dispose();
    }
    OutputFormat format = lossless ? OutputFormat.PNG : OutputFormat.JPEG;
    return new RenderedImage(encode(surface, format), format, attributes);
  }

  /** PNG thumbnail of the most recently rendered surface, longest side {@code maxSide}. */
  public byte[] preview(int maxSide) {
    double scale = Math.min(1.0, (double) maxSide / Math.max(size.width(), size.height()));
    int width = Math.max(1, (int) Math.round(size.width() * scale));
    int height = Math.max(1, (int) Math.round(size.height() * scale));
    BufferedImage thumbnail = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    Graphics2D g2 = thumbnail.createGraphics();
    try {
      g2.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      g2.drawImage(surface, 0, 0, width, height, null);
    } finally {
      g2.dispose();
    }
    return encode(thumbnail, OutputFormat.PNG);
  }

  private void clearSurface() {
    Graphics2D g2 = surface.createGraphics();
    try {
      g2.setComposite(AlphaComposite.Clear);
      g2.fillRect(0, 0, size.width(), size.height());
    } finally {
      g2.dispose();
    }
  }

  private byte[] encode(BufferedImage image, OutputFormat format) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      if (format == OutputFormat.PNG) {
        if (!ImageIO.write(image, format.writerName(), out)) {
          throw RenderException.transientFailure("no PNG encoder available", null);
        }
      } else {
        writeJpeg(flatten(image), out);
      }
    } catch (IOException e) {
      throw RenderException.transientFailure("failed to encode " + format, e);
    }
    return out.toByteArray();
  }

  private void writeJpeg(BufferedImage image, ByteArrayOutputStream out) throws IOException {
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
    if (!writers.hasNext()) {
      throw RenderException.transientFailure("no JPEG encoder available", null);
    }
    ImageWriter writer = writers.next();
    try (ImageOutputStream output = ImageIO.createImageOutputStream(out)) {
      writer.setOutput(output);
      ImageWriteParam param = writer.getDefaultWriteParam();
      param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
      param.setCompressionQuality(lossyQuality);
      writer.write(null, new IIOImage(image, null, null), param);
    } finally {
      writer.dispose();
    }
  }

  // JPEG has no alpha channel; transparent pixels become black
  private static BufferedImage flatten(BufferedImage image) {
    BufferedImage rgb =
        new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
    Graphics2D g2 = rgb.createGraphics();
    try {
      g2.setColor(Color.BLACK);
      g2.fillRect(0, 0, image.getWidth(), image.getHeight());
      g2.drawImage(image, 0, 0, null);
    } finally {
      g2.dispose();
    }
    return rgb;
  }
}
