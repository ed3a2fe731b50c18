/** JSON Schema validation and service contract loading. */
package ca.gc.cra.relay.infrastructure.schema;
