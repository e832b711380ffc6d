/**
 * Inventory model and the capacity enforcement decision.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.stowage.domain.inventory.Inventory} is single-threaded;
 * stacks and size policies are immutable.</p>
 */
package ca.gc.cra.stowage.domain.inventory;
