/**
 * Embedding engines: text and file payloads at one bit per channel, and the adaptive
 * image-in-image engine with its stride walk and parameter advisor.
 */
package ca.gc.cra.veil.domain.codec;
