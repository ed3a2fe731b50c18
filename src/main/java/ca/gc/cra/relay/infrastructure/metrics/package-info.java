/**
 * OpenTelemetry-backed implementation of {@link ca.gc.cra.relay.application.port.MetricsPort}.
 */
package ca.gc.cra.relay.infrastructure.metrics;
