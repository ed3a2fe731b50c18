/** JSON envelope codec. */
package ca.gc.cra.relay.infrastructure.codec;
