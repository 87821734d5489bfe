/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and keep payload contents out of log lines.
 * <p><strong>Role:</strong> Cross-cutting support for the hide, extract and capacity commands.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no metrics.
 * <p><strong>Security:</strong> {@link ca.gc.cra.veil.logging.Logs#redact(String)} replaces hidden messages with
 * their length so secrets never reach a log file.
 *
 * @since 0.1.0
 */
package ca.gc.cra.veil.logging;
