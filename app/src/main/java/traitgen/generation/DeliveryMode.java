package traitgen.generation;

public enum DeliveryMode {
  STREAMING,
  CHUNKED;

  public static DeliveryMode forCount(int count, int streamingThreshold) {
    return count <= streamingThreshold ? STREAMING : CHUNKED;
  }
}
