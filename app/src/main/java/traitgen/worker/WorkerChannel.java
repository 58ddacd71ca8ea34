package traitgen.worker;

/** Orchestrator side of one isolated worker: commands go in, events come back asynchronously. */
public interface WorkerChannel {

  int workerIndex();

  void post(WorkerCommand command);

  /** Stops the worker immediately; later events from it may still arrive and must be ignored. */
  void terminate();
}
