package traitgen.cli;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entrypoint.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code Main generate --catalog catalog.json --count 100 --out out/}
 *   <li>{@code Main generate ... --size 1024x1024 --standard solana --workers 2 --seed 7}
 * </ul>
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  private static final String USAGE =
      String.join(
          System.lineSeparator(),
          "Usage: generate --catalog <file> --count <n> --out <dir> [options]",
          "  --size WxH | --width <px> --height <px>   output size (default 512x512)",
          "  --name <text> --description <text>        collection metadata",
          "  --standard erc721|solana                  metadata standard",
          "  --workers <n>                             maximum worker count",
          "  --seed <n>                                deterministic solver seed",
          "  --ordering rarity-first|weighted-random   candidate ordering");

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    if (args == null || args.length == 0 || "--help".equals(args[0])) {
      System.out.println(USAGE);
      return args == null || args.length == 0 ? GenerateCommand.EXIT_REJECTED : 0;
    }
    try {
      return new GenerateCommand().execute(args);
    } catch (IllegalArgumentException ex) {
      System.err.println(ex.getMessage());
      System.err.println(USAGE);
      return GenerateCommand.EXIT_REJECTED;
    } catch (IOException ex) {
      LOG.error("I/O failure: {}", ex.getMessage(), ex);
      return GenerateCommand.EXIT_FAILED;
    }
  }
}
