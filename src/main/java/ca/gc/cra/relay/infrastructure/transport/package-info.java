/**
 * Transport plumbing shared by broker adapters, plus the in-process transport used for embedded
 * deployments and tests.
 */
package ca.gc.cra.relay.infrastructure.transport;
