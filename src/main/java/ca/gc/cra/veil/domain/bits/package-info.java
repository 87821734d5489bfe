/**
 * Bit-plane primitives: masking the low bits of a channel and queueing bits between payload and carrier.
 * <p><strong>Concurrency:</strong> {@code BitPlanes} is stateless; {@code BitQueue} is single-threaded.</p>
 */
package ca.gc.cra.veil.domain.bits;
