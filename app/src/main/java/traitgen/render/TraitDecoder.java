package traitgen.render;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import traitgen.cache.RunCache;
import traitgen.core.model.OutputSize;
import traitgen.core.model.Trait;

/**
 * Decodes trait payloads straight to the output size.
 *
 * <p>The reader subsamples the source while decoding, so a large payload is never materialized at
 * full resolution; the remaining scale step draws into an ARGB surface of exactly the target size.
 * Decoded surfaces are kept in the run's cache keyed by trait id.
 */
public final class TraitDecoder {
  private static final Logger LOG = LoggerFactory.getLogger(TraitDecoder.class);

  private final OutputSize size;
  private final RunCache<Integer, BufferedImage> cache;

  public TraitDecoder(OutputSize size, RunCache<Integer, BufferedImage> cache) {
    this.size = size;
    this.cache = cache;
  }

  public RunCache<Integer, BufferedImage> cache() {
    return cache;
  }

  public BufferedImage decode(Trait trait) {
    BufferedImage cached = cache.get(trait.id());
    if (cached != null) {
      return cached;
    }
    BufferedImage decoded = decodeScaled(trait);
    cache.set(trait.id(), decoded);
    return decoded;
  }

  private BufferedImage decodeScaled(Trait trait) {
    byte[] payload = trait.payload();
    if (payload.length == 0) {
      throw RenderException.unreadable(
          trait.id(), "trait '" + trait.name() + "' has no payload", null);
    }
    try (ImageInputStream input =
        ImageIO.createImageInputStream(new ByteArrayInputStream(payload))) {
      Iterator<ImageReader> readers = input == null ? null : ImageIO.getImageReaders(input);
      if (readers == null || !readers.hasNext()) {
        throw RenderException.unreadable(
            trait.id(),
            "no decoder for trait '" + trait.name() + "' (" + PayloadFormat.detect(payload) + ")",
            null);
      }
      ImageReader reader = readers.next();
      try {
        reader.setInput(input, true, true);
        int sourceWidth = reader.getWidth(0);
        int sourceHeight = reader.getHeight(0);
        ImageReadParam param = reader.getDefaultReadParam();
        int step =
            Math.max(1, Math.min(sourceWidth / size.width(), sourceHeight / size.height()));
        if (step > 1) {
          param.setSourceSubsampling(step, step, 0, 0);
        }
        BufferedImage source = reader.read(0, param);
        LOG.debug(
            "Decoded trait {} from {}x{} with subsampling {}",
            trait.id(),
            sourceWidth,
            sourceHeight,
            step);
        return fit(source);
      } finally {
        reader.dispose();
      }
    } catch (IIOException e) {
      throw RenderException.unreadable(
          trait.id(), "corrupt payload for trait '" + trait.name() + "': " + e.getMessage(), e);
    } catch (IOException e) {
      throw RenderException.transientFailure(
          "failed to read payload of trait '" + trait.name() + "'", e);
    }
  }

  private BufferedImage fit(BufferedImage source) {
    if (source.getWidth() == size.width()
        && source.getHeight() == size.height()
        && source.getType() == BufferedImage.TYPE_INT_ARGB) {
      return source;
    }
    BufferedImage target =
        new BufferedImage(size.width(), size.height(), BufferedImage.TYPE_INT_ARGB);
    Graphics2D g2 = target.createGraphics();
    try {
      g2.setComposite(AlphaComposite.Src);
      g2.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      g2.drawImage(source, 0, 0, size.width(), size.height(), null);
    } finally {
      g2.dispose();
    }
    return target;
  }
}
