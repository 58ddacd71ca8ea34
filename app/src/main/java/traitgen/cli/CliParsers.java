package traitgen.cli;

import com.google.common.base.Splitter;
import java.util.List;
import java.util.Locale;
import traitgen.solver.CandidateOrdering;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {
  private static final Splitter SIZE_SPLITTER = Splitter.on('x').trimResults().omitEmptyStrings();

  private CliParsers() {}

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static Long parseSeed(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for --seed: " + raw);
    }
  }

  /** Parses {@code WIDTHxHEIGHT}, or a single number for a square. */
  static int[] parseSize(String raw) {
    List<String> parts = SIZE_SPLITTER.splitToList(raw.toLowerCase(Locale.ROOT));
    if (parts.size() == 1) {
      int side = parseInt(parts.get(0), -1, "--size");
      return new int[] {side, side};
    }
    if (parts.size() != 2) {
      throw new IllegalArgumentException("Invalid size, expected WIDTHxHEIGHT: " + raw);
    }
    return new int[] {parseInt(parts.get(0), -1, "--size"), parseInt(parts.get(1), -1, "--size")};
  }

  static CandidateOrdering parseOrdering(String raw) {
    if (raw == null || raw.isBlank()) {
      return CandidateOrdering.RARITY_FIRST;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "rarity", "rarity-first" -> CandidateOrdering.RARITY_FIRST;
      case "weighted", "weighted-random" -> CandidateOrdering.WEIGHTED_RANDOM;
      default -> throw new IllegalArgumentException("Invalid ordering: " + raw);
    };
  }
}
