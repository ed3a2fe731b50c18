package ca.gc.cra.relay.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void workerPoolNamesThreadsAndInstallsHandler() throws Exception {
    CountDownLatch failed = new CountDownLatch(1);
    AtomicReference<Throwable> seen = new AtomicReference<>();
    ExecutorService pool = ExecutorFactories.newWorkerPool(1, "relay-test", (thread, ex) -> {
      seen.set(ex);
      failed.countDown();
    });
    try {
      String name = CompletableFuture.supplyAsync(() -> Thread.currentThread().getName(), pool).get(5, TimeUnit.SECONDS);
      assertEquals("relay-test-0", name);

      IllegalStateException boom = new IllegalStateException("boom");
      pool.execute(() -> {
        throw boom;
      });
      assertTrue(failed.await(5, TimeUnit.SECONDS));
      assertSame(boom, seen.get());
    } finally {
      ExecutorFactories.shutdownGracefully(pool, 1_000L);
    }
    assertTrue(pool.isShutdown());
  }

  @Test
  void schedulerUsesDaemonThreads() throws Exception {
    ScheduledExecutorService scheduler = ExecutorFactories.newScheduler(" ");
    try {
      Thread thread = scheduler.schedule(Thread::currentThread, 0, TimeUnit.MILLISECONDS).get(5, TimeUnit.SECONDS);
      assertTrue(thread.isDaemon());
      assertTrue(thread.getName().startsWith("relay-sweeper-"));
    } finally {
      ExecutorFactories.shutdownGracefully(scheduler, 1_000L);
    }
  }

  @Test
  void rejectsNonPositivePoolSize() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newWorkerPool(0, "x", null));
  }

  @Test
  void shutdownIgnoresNull() {
    ExecutorFactories.shutdownGracefully(null, 10L);
    assertFalse(Thread.currentThread().isInterrupted());
  }
}
