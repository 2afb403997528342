/**
 * <strong>Purpose:</strong> Argument validation shared by reader creation and configuration loading.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Failures surface as {@link java.lang.IllegalArgumentException}; nothing is logged.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tee.validation;
