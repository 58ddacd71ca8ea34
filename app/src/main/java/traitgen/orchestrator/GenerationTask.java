package traitgen.orchestrator;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import traitgen.core.GenerationRequest;
import traitgen.core.model.Assignment;
import traitgen.generation.GenerationListener;

/** One submitted run as the dispatcher tracks it. Mutated only on the dispatcher thread. */
final class GenerationTask {
  final String taskId;
  final GenerationRequest request;
  final GenerationListener listener;
  final TaskComplexity complexity;
  final CompletableFuture<GenerationOutcome> outcome = new CompletableFuture<>();
  final List<Assignment> delivered = new ArrayList<>();
  final long submittedAt;
  WorkerSlot worker;
  int attempts;
  int assignments;
  long startedAt;
  boolean cancelRequested;
  boolean overdueReported;

  GenerationTask(
      String taskId, GenerationRequest request, GenerationListener listener, long submittedAt) {
    this.taskId = taskId;
    this.request = request;
    this.listener = listener;
    this.submittedAt = submittedAt;
    this.complexity =
        TaskComplexity.classify(
            request.layers().size(), request.count(), request.outputSize().pixelCount());
  }

  boolean done() {
    return outcome.isDone();
  }

  @Override
  public String toString() {
    return "Task[" + taskId + ", " + request.count() + " items, " + complexity + "]";
  }
}
