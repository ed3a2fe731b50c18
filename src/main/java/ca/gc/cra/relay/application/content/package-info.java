/**
 * Content model operations: datafile registration with CRC32C checks, dataset and manifest
 * construction, manifest validation, and the URI-only structured representation used on the bus.
 */
package ca.gc.cra.relay.application.content;
