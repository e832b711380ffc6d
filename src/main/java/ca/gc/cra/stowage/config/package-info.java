/**
 * Configuration loading and wiring.
 * <p>Precedence is CLI &gt; YAML &gt; defaults. {@link ca.gc.cra.stowage.config.YamlConfigLoader} flattens the
 * {@code common} and per-command sections, {@link ca.gc.cra.stowage.config.ConfigMerger} applies overrides, and
 * {@link ca.gc.cra.stowage.config.FillConfig} materializes the result for
 * {@link ca.gc.cra.stowage.config.CompositionRoot}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.stowage.config;
