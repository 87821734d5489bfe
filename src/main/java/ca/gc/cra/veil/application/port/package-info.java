/**
 * Ports through which the hide, extract and capacity use cases reach image files and payload files.
 */
package ca.gc.cra.veil.application.port;
