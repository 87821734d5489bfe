/** Image file adapters. */
package ca.gc.cra.veil.infrastructure.image;
