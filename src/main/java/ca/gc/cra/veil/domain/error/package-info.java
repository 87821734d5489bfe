/**
 * Typed codec failures. Every failure carries the sizes involved and none is retried internally.
 */
package ca.gc.cra.veil.domain.error;
