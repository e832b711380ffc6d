/**
 * Input validation helpers shared by the CLI and configuration layers.
 * <p>All helpers throw {@link java.lang.IllegalArgumentException}; the CLI maps those to exit code 2.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.stowage.validation;
