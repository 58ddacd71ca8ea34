package traitgen.worker;

import java.util.function.Consumer;
import traitgen.generation.DeviceProfile;
import traitgen.generation.GenerationOptions;
import traitgen.generation.MemoryMonitor;

/** Creates workers; the orchestrator calls it for new workers and for restarts. */
@FunctionalInterface
public interface WorkerFactory {

  WorkerChannel create(int workerIndex, Consumer<WorkerEvent> events);

  static WorkerFactory inProcess(
      GenerationOptions options, DeviceProfile device, MemoryMonitor memory) {
    return (index, events) -> new GenerationWorker(index, options, device, memory, events);
  }
}
