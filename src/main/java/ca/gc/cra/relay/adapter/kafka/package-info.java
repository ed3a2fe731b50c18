/**
 * Kafka transport adapter.
 */
package ca.gc.cra.relay.adapter.kafka;
