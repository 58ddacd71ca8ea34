package traitgen.worker;

import java.util.List;
import traitgen.core.GenerationRequest;
import traitgen.core.model.Assignment;

/** Messages a worker consumes. */
public interface WorkerCommand {

  /** Readiness handshake; answered with {@link WorkerEvent.Ready}. */
  record Initialize() implements WorkerCommand {}

  /** Liveness check; answered with a {@link WorkerEvent.Pong} echoing the id. */
  record Ping(long id) implements WorkerCommand {}

  /**
   * Starts one run. {@code resumeFrom} lists the assignments an earlier worker already delivered
   * for this task, in index order.
   */
  record Start(String taskId, GenerationRequest request, List<Assignment> resumeFrom)
      implements WorkerCommand {
    public Start {
      resumeFrom = resumeFrom == null ? List.of() : List.copyOf(resumeFrom);
    }
  }

  /** Cooperative abort of the named run. */
  record Cancel(String taskId) implements WorkerCommand {}
}
