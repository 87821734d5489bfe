package ca.gc.cra.veil.application.pipeline;

import ca.gc.cra.veil.application.port.ImageCodecPort;
import ca.gc.cra.veil.config.CapacityConfig;
import ca.gc.cra.veil.config.PayloadType;
import ca.gc.cra.veil.domain.capacity.CapacityCalculator;
import ca.gc.cra.veil.domain.capacity.CapacityReport;
import ca.gc.cra.veil.domain.capacity.ImageCapacityEstimate;
import ca.gc.cra.veil.domain.codec.AdaptiveImageEmbedder;
import ca.gc.cra.veil.domain.codec.BlobEmbedder;
import ca.gc.cra.veil.domain.codec.TextEmbedder;
import ca.gc.cra.veil.domain.image.RgbImage;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports how much each payload kind can hide in a carrier. Read-only; never writes files.
 *
 * @since 0.1.0
 */
public final class CapacityUseCase {
  private static final Logger log = LoggerFactory.getLogger(CapacityUseCase.class);

  private final TextEmbedder textEmbedder;
  private final BlobEmbedder blobEmbedder;
  private final AdaptiveImageEmbedder imageEmbedder;
  private final ImageCodecPort images;
  private final double safeUsageFraction;

  public CapacityUseCase(
      TextEmbedder textEmbedder,
      BlobEmbedder blobEmbedder,
      AdaptiveImageEmbedder imageEmbedder,
      ImageCodecPort images,
      double safeUsageFraction) {
    this.textEmbedder = Objects.requireNonNull(textEmbedder, "textEmbedder");
    this.blobEmbedder = Objects.requireNonNull(blobEmbedder, "blobEmbedder");
    this.imageEmbedder = Objects.requireNonNull(imageEmbedder, "imageEmbedder");
    this.images = Objects.requireNonNull(images, "images");
    this.safeUsageFraction = safeUsageFraction;
  }

  /**
   * Computes the capacity summary.
   *
   * @param config carrier and optional payload kind
   * @return capacity per requested kind
   * @throws IOException if the carrier cannot be read
   */
  public CapacitySummary run(CapacityConfig config) throws IOException {
    Objects.requireNonNull(config, "config");
    RgbImage carrier = images.read(config.carrier());
    Optional<PayloadType> only = config.type();
    Optional<CapacityReport> text = wanted(only, PayloadType.TEXT)
        ? Optional.of(textEmbedder.capacity(carrier, safeUsageFraction))
        : Optional.empty();
    Optional<CapacityReport> file = wanted(only, PayloadType.FILE)
        ? Optional.of(blobEmbedder.capacity(carrier, safeUsageFraction))
        : Optional.empty();
    List<ImageCapacityEstimate> image = wanted(only, PayloadType.IMAGE)
        ? CapacityCalculator.imageCapacityTable(carrier.width(), carrier.height(), imageEmbedder.headerSlots())
        : List.of();
    log.debug("Capacity of {}x{} carrier computed for {}", carrier.width(), carrier.height(),
        only.map(PayloadType::name).orElse("all types"));
    return new CapacitySummary(config.carrier(), carrier.width(), carrier.height(), text, file, image);
  }

  private static boolean wanted(Optional<PayloadType> only, PayloadType type) {
    return only.isEmpty() || only.get() == type;
  }
}
