/**
 * CLI entry points for the {@code hide}, {@code extract} and {@code capacity} commands.
 * <p><strong>Role:</strong> Driving adapters; parse arguments, configure logging and invoke use cases.</p>
 * <p><strong>Output:</strong> Results go to stdout through {@link ca.gc.cra.veil.api.CliPrinter};
 * logs go to stderr.</p>
 * <p><strong>Security:</strong> Validates user-supplied paths and never logs hidden message text.</p>
 */
package ca.gc.cra.veil.api;
