/** Local file storage adapter. */
package ca.gc.cra.relay.infrastructure.storage;
