/**
 * Command-line entry points.
 * <p>{@link ca.gc.cra.stowage.api.Main} dispatches to {@link ca.gc.cra.stowage.api.FillCli} and
 * {@link ca.gc.cra.stowage.api.CatalogCli}. Arguments are {@code key=value} pairs plus flags; every outcome maps to
 * an {@link ca.gc.cra.stowage.api.ExitCode}.</p>
 */
package ca.gc.cra.stowage.api;
