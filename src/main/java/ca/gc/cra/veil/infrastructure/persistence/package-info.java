/** Filesystem adapters for secret and recovered payload files. */
package ca.gc.cra.veil.infrastructure.persistence;
