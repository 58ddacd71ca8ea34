package traitgen.orchestrator;

import java.util.concurrent.CompletableFuture;

/** Caller side of one submitted run. */
public interface GenerationHandle {

  String taskId();

  TaskComplexity complexity();

  /** Completes exactly once with the terminal outcome; never completes exceptionally. */
  CompletableFuture<GenerationOutcome> outcome();

  /** Requests cooperative cancellation; a no-op once the run has ended. */
  void cancel();
}
