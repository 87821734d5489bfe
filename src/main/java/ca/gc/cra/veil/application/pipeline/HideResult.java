package ca.gc.cra.veil.application.pipeline;

import ca.gc.cra.veil.config.PayloadType;
import ca.gc.cra.veil.domain.header.ImageHeader;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of a hide run.
 *
 * @param type payload kind
 * @param output stego image written
 * @param payloadBytes size of the hidden payload in bytes (channel count for images)
 * @param imageHeader parameters used for image payloads
 */
public record HideResult(PayloadType type, Path output, long payloadBytes, Optional<ImageHeader> imageHeader) {}
