package ca.gc.cra.veil.application.pipeline;

import ca.gc.cra.veil.config.PayloadType;
import ca.gc.cra.veil.domain.header.ImageHeader;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of an extract run.
 *
 * @param type payload kind
 * @param message recovered text for {@link PayloadType#TEXT}
 * @param output file written for {@link PayloadType#FILE} and {@link PayloadType#IMAGE}
 * @param payloadBytes size of the recovered payload in bytes
 * @param imageHeader header read for image payloads
 */
public record ExtractResult(
    PayloadType type,
    Optional<String> message,
    Optional<Path> output,
    long payloadBytes,
    Optional<ImageHeader> imageHeader) {}
