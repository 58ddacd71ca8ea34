package traitgen.metadata;

import java.util.Locale;

/** Supported metadata layouts. */
public enum MetadataStandard {
  ERC721,
  SOLANA;

  public MetadataFormatter formatter() {
    return switch (this) {
      case SOLANA -> new SolanaFormatter();
      case ERC721 -> new Erc721Formatter();
    };
  }

  /** Parses a selector case-insensitively; unknown or blank values fall back to {@link #ERC721}. */
  public static MetadataStandard fromString(String value) {
    if (value == null || value.isBlank()) {
      return ERC721;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace("-", "");
    for (MetadataStandard standard : values()) {
      if (standard.name().equals(normalized)) {
        return standard;
      }
    }
    return ERC721;
  }
}
