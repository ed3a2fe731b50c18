package ca.gc.cra.relay.config;

import ca.gc.cra.relay.adapter.kafka.KafkaTransportAdapter;
import ca.gc.cra.relay.application.invocation.ChildServiceProxy;
import ca.gc.cra.relay.application.invocation.CorrelationRegistry;
import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.application.port.EnvelopeCodec;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.SchemaValidator;
import ca.gc.cra.relay.application.port.TransportPort;
import ca.gc.cra.relay.application.responder.Analysis;
import ca.gc.cra.relay.application.responder.ParentServiceResponder;
import ca.gc.cra.relay.domain.contract.ServiceContract;
import ca.gc.cra.relay.infrastructure.codec.JsonEnvelopeCodec;
import ca.gc.cra.relay.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.relay.infrastructure.schema.NetworkntSchemaValidator;
import ca.gc.cra.relay.infrastructure.schema.ServiceContractLoader;
import ca.gc.cra.relay.infrastructure.transport.InMemoryTransportAdapter;
import ca.gc.cra.relay.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires invokers and responders to concrete adapters.
 * <p><strong>Why:</strong> Keeps the translation from configuration to runnable services in one place.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the Kafka or in-memory transport with a codec sized from configuration.</li>
 *   <li>Share one in-memory bus between every service built by this root.</li>
 *   <li>Build {@link ChildServiceProxy} and {@link ParentServiceResponder} instances.</li>
 *   <li>Close everything it built, newest first.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Factory methods are synchronized; intended for startup.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MetricsPort metrics;
  private final ClockPort clock;
  private final SchemaValidator schemaValidator;
  private final Deque<AutoCloseable> owned = new ArrayDeque<>();
  private Wiring memoryWiring;

  private record Wiring(TransportPort transport, EnvelopeCodec codec) {}

  /** Creates a root publishing metrics through OpenTelemetry and using the system clock. */
  public CompositionRoot() {
    this(new OpenTelemetryMetricsAdapter(), ClockPort.SYSTEM);
  }

  /**
   * Creates a root with explicit metrics and clock.
   *
   * @param metrics metrics sink shared by every component
   * @param clock time source shared by every component
   */
  public CompositionRoot(MetricsPort metrics, ClockPort clock) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.schemaValidator = new NetworkntSchemaValidator();
  }

  /** Metrics sink shared by every component. */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds an invoker listening on {@code relay.answers.<invokerId>}.
   *
   * @param config invoker configuration
   * @return running proxy, closed with this root
   */
  public synchronized ChildServiceProxy invoker(InvokerConfig config) {
    Objects.requireNonNull(config, "config");
    applyLogging(config.verbose());
    Wiring wiring = wiring(config.transport());
    ChildServiceProxy proxy = new ChildServiceProxy(
        config.invokerId(),
        wiring.transport(),
        wiring.codec(),
        new CorrelationRegistry(clock, metrics),
        schemaValidator,
        clock,
        metrics,
        config.proxySettings());
    owned.push(proxy);
    return proxy;
  }

  /**
   * Builds and starts a responder answering on {@code relay.services.<serviceId>}.
   *
   * @param config responder configuration
   * @param analysis analysis run for each valid question
   * @return started responder, closed with this root
   * @throws IOException if the configured contract cannot be read
   */
  public synchronized ParentServiceResponder responder(ResponderConfig config, Analysis analysis)
      throws IOException {
    Objects.requireNonNull(config, "config");
    applyLogging(config.verbose());
    ServiceContract contract = config.contractPath().isPresent()
        ? new ServiceContractLoader().load(config.contractPath().get())
        : ServiceContract.permissive();
    Wiring wiring = wiring(config.transport());
    ParentServiceResponder responder = new ParentServiceResponder(
        config.serviceId(),
        contract,
        analysis,
        wiring.transport(),
        wiring.codec(),
        schemaValidator,
        clock,
        metrics,
        config.responderSettings());
    owned.push(responder);
    return responder.start();
  }

  private Wiring wiring(TransportConfig config) {
    EnvelopeCodec codec = new JsonEnvelopeCodec(config.maxPayloadBytes(), metrics);
    if (config.mode() == TransportMode.MEMORY) {
      if (memoryWiring == null) {
        InMemoryTransportAdapter transport = new InMemoryTransportAdapter(
            codec,
            metrics,
            config.publishPolicy(),
            config.maxInFlight(),
            config.redeliveryDelay(),
            config.deadLetterEnabled());
        memoryWiring = new Wiring(transport, codec);
        owned.push(transport);
        log.info("Using in-memory transport");
      }
      return memoryWiring;
    }
    KafkaTransportAdapter transport = new KafkaTransportAdapter(
        config.kafkaBootstrap().orElseThrow(),
        config.groupId(),
        codec,
        metrics,
        config.publishPolicy(),
        config.maxInFlight(),
        config.deadLetterEnabled());
    owned.push(transport);
    log.info("Using Kafka transport at {} (group {})", config.kafkaBootstrap().get(), config.groupId());
    return new Wiring(transport, codec);
  }

  private static void applyLogging(boolean verbose) {
    if (verbose) {
      LoggingConfigurator.enableVerboseLogging();
    }
  }

  @Override
  public synchronized void close() {
    while (!owned.isEmpty()) {
      AutoCloseable component = owned.pop();
      try {
        component.close();
      } catch (Exception ex) {
        log.warn("Failed to close {}", component.getClass().getSimpleName(), ex);
      }
    }
    memoryWiring = null;
    if (metrics instanceof AutoCloseable closeableMetrics) {
      try {
        closeableMetrics.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
