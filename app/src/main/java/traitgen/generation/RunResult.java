package traitgen.generation;

/** Non-failing end of a run: {@link RunState#COMPLETED} or {@link RunState#CANCELLED}. */
public record RunResult(RunState state, int generated, int requested, RunStats stats) {}
