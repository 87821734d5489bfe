/** Machine-readable renderings of capacity reports. */
package ca.gc.cra.veil.infrastructure.report;
