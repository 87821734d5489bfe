package ca.gc.cra.veil.domain.codec;

import ca.gc.cra.veil.domain.header.ImageHeader;
import ca.gc.cra.veil.domain.image.RgbImage;

/**
 * Image recovered from a carrier together with the header that described it.
 *
 * <p>Channels carry only the top {@code header.msb()} bits of the original; the rest are zero.</p>
 *
 * @param header parameters read from the carrier
 * @param image recovered pixels
 */
public record RecoveredImage(ImageHeader header, RgbImage image) {}
