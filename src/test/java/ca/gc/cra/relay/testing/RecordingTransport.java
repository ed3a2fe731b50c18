package ca.gc.cra.relay.testing;

import ca.gc.cra.relay.application.port.EnvelopeHandler;
import ca.gc.cra.relay.application.port.Subscription;
import ca.gc.cra.relay.application.port.TransportPort;
import ca.gc.cra.relay.domain.envelope.Envelope;
import ca.gc.cra.relay.domain.error.TransportException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/** Transport that records publishes and hands subscriptions back to the test. */
public final class RecordingTransport implements TransportPort {

  /** A published envelope. */
  public record Published(String destination, Envelope envelope) {}

  private final List<Published> published = new CopyOnWriteArrayList<>();
  private final Map<String, EnvelopeHandler> handlers = new ConcurrentHashMap<>();
  private final AtomicInteger failuresToInject = new AtomicInteger();
  private final AtomicBoolean closed = new AtomicBoolean();

  @Override
  public void publish(String destination, Envelope envelope) {
    if (failuresToInject.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
      throw new TransportException("Injected failure publishing to " + destination, 1, null);
    }
    published.add(new Published(destination, envelope));
  }

  @Override
  public Subscription subscribe(String source, EnvelopeHandler handler, int concurrency) {
    handlers.put(source, handler);
    AtomicBoolean active = new AtomicBoolean(true);
    return new Subscription() {
      @Override
      public String source() {
        return source;
      }

      @Override
      public int inFlight() {
        return 0;
      }

      @Override
      public boolean isActive() {
        return active.get();
      }

      @Override
      public void close() {
        active.set(false);
        handlers.remove(source, handler);
      }
    };
  }

  @Override
  public void close() {
    closed.set(true);
  }

  /** Fails the next {@code count} publishes. */
  public void failNextPublishes(int count) {
    failuresToInject.set(count);
  }

  public List<Published> published() {
    return List.copyOf(published);
  }

  public List<Envelope> publishedTo(String destination) {
    return published.stream()
        .filter(p -> p.destination().equals(destination))
        .map(Published::envelope)
        .collect(Collectors.toList());
  }

  public EnvelopeHandler handler(String source) {
    return handlers.get(source);
  }

  public boolean isClosed() {
    return closed.get();
  }
}
