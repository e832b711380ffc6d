/**
 * Item catalog model: immutable {@link ca.gc.cra.stowage.domain.catalog.Item}s and the ordered
 * {@link ca.gc.cra.stowage.domain.catalog.Catalog} that resolves identifiers to them.
 */
package ca.gc.cra.stowage.domain.catalog;
