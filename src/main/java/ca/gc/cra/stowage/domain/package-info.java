/**
 * Core domain model for the Stowage catalog → request → inventory pipeline.
 * <p><strong>Role:</strong> Domain layer describing items, stacks, inventories, and classified request lines
 * without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Value types are immutable; {@link ca.gc.cra.stowage.domain.inventory.Inventory}
 * is mutable and confined to the thread that fills it.</p>
 * <p><strong>Metrics:</strong> Domain decisions feed the {@code fill.*} counters emitted by the application layer.</p>
 */
package ca.gc.cra.stowage.domain;
