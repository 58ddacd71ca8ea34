package traitgen.orchestrator;

import traitgen.worker.WorkerChannel;

/**
 * Orchestrator bookkeeping for one worker position. Restarts reuse the slot with a new channel and
 * a higher epoch, so events from the replaced channel can be recognised and dropped. Mutated only
 * on the orchestrator's dispatcher thread.
 */
final class WorkerSlot {
  final int index;
  WorkerChannel channel;
  int epoch;
  WorkerHealth health = WorkerHealth.INITIALIZING;
  GenerationTask task;
  int restarts;
  int errorCount;
  int consecutiveErrors;
  int completedTasks;
  long totalTaskMillis;
  long createdAt;
  long idleSince;
  long pendingPingId = -1;
  long pingSentAt;
  long busyUntil;

  WorkerSlot(int index) {
    this.index = index;
  }

  boolean idleAt(long now) {
    return task == null && now >= busyUntil;
  }

  int activeTasks() {
    return task == null ? 0 : 1;
  }

  long averageTaskMillis() {
    return completedTasks == 0 ? 0 : totalTaskMillis / completedTasks;
  }

  @Override
  public String toString() {
    return "Worker#" + index + "[" + health + ", epoch " + epoch + ", restarts " + restarts + "]";
  }
}
