package jfhall.filelog.impl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class HandoffQueueTest {
  private ExecutorService executor;

  @BeforeEach
  public void setup() {
    this.executor = Executors.newCachedThreadPool();
  }

  @AfterEach
  public void cleanup() {
    this.executor.shutdownNow();
  }

  @Test
  public void testDeliversInSubmissionOrder() throws Exception {
    final HandoffQueue<Integer> queue = new HandoffQueue<>(4);
    final Future<?> relay = this.executor.submit(queue);

    final Future<?> producer =
        this.executor.submit(
            () -> {
              for (int i = 0; i < 1_000; i++) {
                queue.put(i);
              }
              return null;
            });

    final List<Integer> received = new ArrayList<>();
    while (received.size() < 1_000) {
      final Integer next = queue.poll(5, TimeUnit.SECONDS);
      Assertions.assertNotNull(next, "Relay stopped handing over entries.");
      received.add(next);
    }

    producer.get(5, TimeUnit.SECONDS);
    queue.cancel();
    relay.get(5, TimeUnit.SECONDS);

    Assertions.assertEquals(
        IntStream.range(0, 1_000).boxed().collect(Collectors.toList()), received);
    Assertions.assertTrue(queue.drain().isEmpty());
  }

  @Test
  public void testFullEntryQueueBlocksInsteadOfDropping() throws Exception {
    final HandoffQueue<String> queue = new HandoffQueue<>(2);

    // The relay is not running yet, so nothing leaves the entry queue.
    queue.put("a");
    queue.put("b");
    final Future<?> blocked =
        this.executor.submit(
            () -> {
              queue.put("c");
              return null;
            });

    Thread.sleep(200);
    Assertions.assertFalse(blocked.isDone(), "put should wait while the entry queue is full");

    final Future<?> relay = this.executor.submit(queue);

    Assertions.assertEquals("a", queue.poll(5, TimeUnit.SECONDS));
    Assertions.assertEquals("b", queue.poll(5, TimeUnit.SECONDS));
    Assertions.assertEquals("c", queue.poll(5, TimeUnit.SECONDS));
    blocked.get(5, TimeUnit.SECONDS);

    queue.cancel();
    relay.get(5, TimeUnit.SECONDS);
  }

  @Test
  public void testIdleConsumerDoesNotHoldBackProducers() throws Exception {
    final HandoffQueue<Integer> queue = new HandoffQueue<>(2);
    final Future<?> relay = this.executor.submit(queue);

    // Nobody polls, the relay still has to take every entry off the entry queue.
    final Future<?> producer =
        this.executor.submit(
            () -> {
              for (int i = 0; i < 1_000; i++) {
                queue.put(i);
              }
              return null;
            });
    producer.get(500, TimeUnit.MILLISECONDS);

    final List<Integer> received = new ArrayList<>();
    for (int i = 0; i < 1_000; i++) {
      received.add(queue.poll(5, TimeUnit.SECONDS));
    }
    queue.cancel();
    relay.get(5, TimeUnit.SECONDS);

    Assertions.assertEquals(
        IntStream.range(0, 1_000).boxed().collect(Collectors.toList()), received);
  }

  @Test
  public void testCancelKeepsUnconsumedEntriesInOrder() throws Exception {
    final HandoffQueue<String> queue = new HandoffQueue<>(8);
    final Future<?> relay = this.executor.submit(queue);

    for (final String entry : Arrays.asList("a", "b", "c", "d", "e")) {
      queue.put(entry);
    }
    Assertions.assertEquals("a", queue.poll(5, TimeUnit.SECONDS));

    queue.cancel();
    relay.get(5, TimeUnit.SECONDS);

    Assertions.assertEquals(Arrays.asList("b", "c", "d", "e"), queue.drain());
  }

  @Test
  public void testDrainWithoutRelayReturnsEntryQueue() throws Exception {
    final HandoffQueue<String> queue = new HandoffQueue<>(8);
    queue.put("x");
    queue.put("y");

    Assertions.assertEquals(Arrays.asList("x", "y"), queue.drain());
  }
}
