/**
 * Fill pipeline: segmentation, inventory allocation, stack resolution, capacity decisions, and auditing.
 * <p><strong>Concurrency:</strong> Strictly sequential; inventories are filled one after another on the caller's
 * thread.</p>
 * <p><strong>Metrics:</strong> Emits the {@code fill.*} namespace through
 * {@link ca.gc.cra.stowage.application.port.MetricsPort}.</p>
 */
package ca.gc.cra.stowage.application.pipeline;
