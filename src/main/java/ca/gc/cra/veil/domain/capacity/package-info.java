/**
 * Capacity arithmetic shared by the embedding engines and the capacity report.
 */
package ca.gc.cra.veil.domain.capacity;
