/**
 * Classified request-file records: inventory markers, stack requests, and everything else.
 */
package ca.gc.cra.stowage.domain.line;
