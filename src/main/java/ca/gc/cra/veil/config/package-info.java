/**
 * Configuration aggregates and composition root wiring for VEIL CLIs.
 * <p><strong>Role:</strong> Bootstrap layer merging defaults, YAML and CLI settings and selecting engines.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Paths are normalized here and validated by {@code ca.gc.cra.veil.validation}.</p>
 */
package ca.gc.cra.veil.config;
