/**
 * Text-file adapters for the item catalog and the inventory request file.
 * <p><strong>Role:</strong> Driven-side adapters implementing the catalog and request line ports.</p>
 * <p><strong>Security:</strong> Echoed input is truncated via {@link ca.gc.cra.stowage.logging.Logs} before it reaches
 * logs or error messages.</p>
 */
package ca.gc.cra.stowage.infrastructure.text;
