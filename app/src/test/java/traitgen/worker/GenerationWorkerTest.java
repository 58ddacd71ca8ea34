package traitgen.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import traitgen.core.ErrorCode;
import traitgen.core.GenerationRequest;
import traitgen.core.model.UniquenessConfig;
import traitgen.generation.DeviceProfile;
import traitgen.generation.GenerationOptions;
import traitgen.generation.MemoryMonitor;
import traitgen.testing.TestCatalogs;

@Timeout(30)
final class GenerationWorkerTest {
  private final BlockingQueue<WorkerEvent> events = new LinkedBlockingQueue<>();
  private final GenerationWorker worker =
      new GenerationWorker(
          0,
          GenerationOptions.defaults().withSeed(7L),
          DeviceProfile.of(2, 1),
          MemoryMonitor.fixed(0.5),
          events::add);

  @AfterEach
  void stop() {
    worker.terminate();
  }

  @Test
  void answersHandshakeAndPings() throws InterruptedException {
    worker.post(new WorkerCommand.Initialize());
    worker.post(new WorkerCommand.Ping(41));

    assertInstanceOf(WorkerEvent.Ready.class, next());
    assertEquals(new WorkerEvent.Pong(41), next());
  }

  @Test
  void runsATaskAndEndsWithComplete() throws InterruptedException {
    worker.post(
        new WorkerCommand.Start(
            "t1",
            TestCatalogs.request(
                TestCatalogs.colorsAndShapes(), 4, TestCatalogs.uniqueOver("color", "shape")),
            List.of()));

    int artifacts = 0;
    WorkerEvent event;
    while (!(event = next()).terminal()) {
      assertEquals("t1", event.taskId());
      if (event instanceof WorkerEvent.Artifacts batch) {
        artifacts += batch.artifacts().size();
      }
    }
    WorkerEvent.Complete complete = assertInstanceOf(WorkerEvent.Complete.class, event);
    assertEquals(4, complete.generated());
    assertEquals(4, artifacts);
  }

  @Test
  void reportsInfeasibleRequestsAsErrors() throws InterruptedException {
    worker.post(
        new WorkerCommand.Start(
            "t1",
            TestCatalogs.request(
                TestCatalogs.colorsAndShapes(), 5, TestCatalogs.uniqueOver("color", "shape")),
            List.of()));

    WorkerEvent.Error error =
        assertInstanceOf(WorkerEvent.Error.class, nextMatching(WorkerEvent::terminal));
    assertEquals(ErrorCode.INFEASIBLE, error.code());
    assertEquals("t1", error.taskId());
  }

  @Test
  void rejectsASecondTaskAndCancelsTheFirst() throws InterruptedException {
    worker.post(new WorkerCommand.Start("long", endless(), List.of()));
    nextMatching(event -> event instanceof WorkerEvent.Artifacts);

    worker.post(new WorkerCommand.Start("second", endless(), List.of()));
    WorkerEvent.Error busy =
        assertInstanceOf(
            WorkerEvent.Error.class, nextMatching(event -> "second".equals(event.taskId())));
    assertEquals(ErrorCode.WORKER_BUSY, busy.code());
    assertTrue(busy.recoverable());

    worker.post(new WorkerCommand.Cancel("other"));
    worker.post(new WorkerCommand.Cancel("long"));
    WorkerEvent.Cancelled cancelled =
        assertInstanceOf(WorkerEvent.Cancelled.class, nextMatching(WorkerEvent::terminal));
    assertEquals("long", cancelled.taskId());
    assertTrue(cancelled.generated() > 0);
  }

  @Test
  void acceptsTheNextTaskAsSoonAsTheTerminalEventArrives() throws InterruptedException {
    int tasks = 25;
    List<WorkerEvent> terminals = new CopyOnWriteArrayList<>();
    CountDownLatch finished = new CountDownLatch(tasks);
    AtomicReference<GenerationWorker> chained = new AtomicReference<>();
    GenerationWorker backToBack =
        new GenerationWorker(
            1,
            GenerationOptions.defaults().withSeed(7L),
            DeviceProfile.of(2, 1),
            MemoryMonitor.fixed(0.5),
            event -> {
              if (!event.terminal()) {
                return;
              }
              terminals.add(event);
              finished.countDown();
              if (terminals.size() < tasks) {
                String next = "t" + terminals.size();
                chained.get().post(new WorkerCommand.Start(next, tiny(), List.of()));
              }
            });
    chained.set(backToBack);
    try {
      backToBack.post(new WorkerCommand.Start("t0", tiny(), List.of()));

      assertTrue(finished.await(20, TimeUnit.SECONDS), "chain stalled at " + terminals.size());
      List<String> ids = new ArrayList<>();
      for (WorkerEvent terminal : terminals) {
        assertInstanceOf(WorkerEvent.Complete.class, terminal, terminal.toString());
        ids.add(terminal.taskId());
      }
      assertEquals("t0", ids.get(0));
      assertEquals("t" + (tasks - 1), ids.get(tasks - 1));
    } finally {
      backToBack.terminate();
    }
  }

  @Test
  void unknownCommandsAreAnsweredWithAnError() throws InterruptedException {
    worker.post(new WorkerCommand() {});

    WorkerEvent.Error error = assertInstanceOf(WorkerEvent.Error.class, next());
    assertEquals(ErrorCode.UNKNOWN_MESSAGE, error.code());
  }

  private static GenerationRequest tiny() {
    return TestCatalogs.request(TestCatalogs.colorsAndShapes(), 1, UniquenessConfig.disabled());
  }

  private static GenerationRequest endless() {
    return TestCatalogs.request(TestCatalogs.grid(2, 20), 100_000, UniquenessConfig.disabled());
  }

  private WorkerEvent next() throws InterruptedException {
    WorkerEvent event = events.poll(10, TimeUnit.SECONDS);
    assertNotNull(event, "worker went silent");
    return event;
  }

  private WorkerEvent nextMatching(Predicate<WorkerEvent> filter) throws InterruptedException {
    WorkerEvent event;
    do {
      event = next();
    } while (!filter.test(event));
    return event;
  }
}
