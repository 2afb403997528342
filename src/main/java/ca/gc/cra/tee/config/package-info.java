/**
 * Tee configuration: the {@link ca.gc.cra.tee.config.TeeConfig} record and its YAML loader.
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Validation:</strong> Relies on {@code ca.gc.cra.tee.validation} utilities.</p>
 */
package ca.gc.cra.tee.config;
