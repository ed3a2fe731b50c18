/**
 * Service identities, advertised contracts, and destination naming.
 */
package ca.gc.cra.relay.domain.contract;
