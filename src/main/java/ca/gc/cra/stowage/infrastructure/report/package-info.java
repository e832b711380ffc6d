/**
 * Plain-text rendering of fill results for the console or an output file.
 */
package ca.gc.cra.stowage.infrastructure.report;
