package traitgen.generation;

/** Low-resolution PNG of one artifact, sampled in streaming mode. */
public record Preview(int index, byte[] png) {}
