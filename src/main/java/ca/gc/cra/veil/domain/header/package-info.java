/**
 * Self-describing headers stored in the reserved region at the start of a carrier.
 */
package ca.gc.cra.veil.domain.header;
