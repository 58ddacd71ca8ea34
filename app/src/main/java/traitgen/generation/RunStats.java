package traitgen.generation;

/** Counters of one finished run, logged at completion and carried in its result. */
public record RunStats(
    int generated,
    int failedItems,
    long retries,
    long backtracks,
    long deadEndHits,
    long hashedKeys,
    double decodeHitRate,
    long elapsedMillis) {

  public static RunStats empty() {
    return new RunStats(0, 0, 0, 0, 0, 0, 0.0, 0);
  }

  @Override
  public String toString() {
    return String.format(
        "generated=%d failed=%d retries=%d backtracks=%d deadEndHits=%d hashedKeys=%d"
            + " decodeHitRate=%.2f elapsed=%dms",
        generated,
        failedItems,
        retries,
        backtracks,
        deadEndHits,
        hashedKeys,
        decodeHitRate,
        elapsedMillis);
  }
}
