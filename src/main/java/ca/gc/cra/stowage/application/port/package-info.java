/**
 * Ports between the fill pipeline and its adapters.
 * <p><strong>Role:</strong> Driven-side interfaces for catalog input, request input, and metrics.</p>
 * <p><strong>Concurrency:</strong> Sources are invoked once, on the CLI thread, before processing begins.</p>
 */
package ca.gc.cra.stowage.application.port;
