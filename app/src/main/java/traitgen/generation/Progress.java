package traitgen.generation;

/** Progress notice; {@code memory} is absent when no reading was taken. */
public record Progress(int generated, int total, String status, MemorySnapshot memory) {}
