package ca.gc.cra.relay.infrastructure.metrics;

import ca.gc.cra.relay.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards RELAY counters and observations to OpenTelemetry.
 *
 * <p>Each distinct key maps to one lazily created instrument; the original key is attached as
 * the {@code relay.metric.key} attribute so dashboards can group by component prefix
 * ({@code invoker}, {@code responder}, {@code transport}, {@code codec}).</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("relay.metric.key");
  private static final AttributeKey<String> COMPONENT_ATTRIBUTE = AttributeKey.stringKey("relay.component");
  private static final String FALLBACK_METRIC_NAME = "relay.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final boolean noop;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Attributes> attributes = new ConcurrentHashMap<>();

  /** Creates an adapter wired to the environment-configured OpenTelemetry exporter. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    this.noop = bootstrap.isNoop();
    if (noop) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    if (noop) {
      return;
    }
    counters.computeIfAbsent(key, this::createCounter).add(1, attributesFor(key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    if (noop) {
      return;
    }
    histograms.computeIfAbsent(key, this::createHistogram).record(value, attributesFor(key));
  }

  /** Flushes pending exports; used before shutdown and by tests. */
  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private LongCounter createCounter(String key) {
    return meter.counterBuilder(sanitizeName(key))
        .setUnit("1")
        .setDescription("RELAY counter for " + key)
        .build();
  }

  private LongHistogram createHistogram(String key) {
    return meter.histogramBuilder(sanitizeName(key))
        .ofLongs()
        .setDescription("RELAY observation for " + key)
        .build();
  }

  private Attributes attributesFor(String key) {
    return attributes.computeIfAbsent(key, k -> {
      int dot = k.indexOf('.');
      String component = dot > 0 ? k.substring(0, dot) : k;
      return Attributes.of(METRIC_KEY_ATTRIBUTE, k, COMPONENT_ATTRIBUTE, component);
    });
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean allowed = Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
      result.append(allowed ? c : '_');
    }
    String sanitized = result.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }
}
