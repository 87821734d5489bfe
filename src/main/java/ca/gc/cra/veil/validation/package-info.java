/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Role:</strong> Rejects unreadable carriers, unwritable outputs and out-of-range numbers before any
 * image is decoded or written.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No logging; failures surface via {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Rejects control characters in paths and reduces header-supplied file names to a
 * safe alphabet.
 *
 * @since 0.1.0
 */
package ca.gc.cra.veil.validation;
