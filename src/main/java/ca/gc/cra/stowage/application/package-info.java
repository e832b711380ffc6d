/**
 * Application layer orchestration for Stowage fill runs.
 * <p><strong>Role:</strong> Hosts the fill use case and the ports it drives.</p>
 * <p><strong>Concurrency:</strong> Single-threaded batch processing.</p>
 */
package ca.gc.cra.stowage.application;
