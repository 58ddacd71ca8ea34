package traitgen.generation;

/**
 * One abandoned item. {@code excludedTraitId} is set when the offending trait was removed from the
 * rest of the run.
 */
public record ItemFailure(int index, String message, Integer excludedTraitId) {}
