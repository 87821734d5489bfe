/**
 * Use cases behind the {@code hide}, {@code extract} and {@code capacity} commands.
 *
 * <p>Each use case loads its inputs through the {@code application.port} interfaces, runs one of
 * the domain codecs and writes outputs through the same ports. Use cases are built once by
 * {@link ca.gc.cra.veil.config.CompositionRoot}.</p>
 */
package ca.gc.cra.veil.application.pipeline;
