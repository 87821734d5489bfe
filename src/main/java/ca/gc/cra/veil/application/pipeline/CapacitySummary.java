package ca.gc.cra.veil.application.pipeline;

import ca.gc.cra.veil.domain.capacity.CapacityReport;
import ca.gc.cra.veil.domain.capacity.ImageCapacityEstimate;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Capacity of one carrier for the requested payload kinds.
 *
 * @param carrier inspected carrier
 * @param width carrier width in pixels
 * @param height carrier height in pixels
 * @param text text capacity, when requested
 * @param file file capacity, when requested
 * @param image per-LSB image capacity, empty when not requested
 */
public record CapacitySummary(
    Path carrier,
    int width,
    int height,
    Optional<CapacityReport> text,
    Optional<CapacityReport> file,
    List<ImageCapacityEstimate> image) {
  public CapacitySummary {
    image = List.copyOf(image);
  }
}
