package ca.gc.cra.veil.application.pipeline;

import ca.gc.cra.veil.application.port.ImageCodecPort;
import ca.gc.cra.veil.application.port.PayloadFilePort;
import ca.gc.cra.veil.config.CodecConfig;
import ca.gc.cra.veil.config.HideConfig;
import ca.gc.cra.veil.config.PayloadType;
import ca.gc.cra.veil.domain.capacity.CapacityCalculator;
import ca.gc.cra.veil.domain.codec.AdaptiveImageEmbedder;
import ca.gc.cra.veil.domain.codec.BlobEmbedder;
import ca.gc.cra.veil.domain.codec.ImageEmbedParameters;
import ca.gc.cra.veil.domain.codec.ParameterAdvisor;
import ca.gc.cra.veil.domain.codec.TextEmbedder;
import ca.gc.cra.veil.domain.error.CapacityExceededException;
import ca.gc.cra.veil.domain.error.StegoException;
import ca.gc.cra.veil.domain.header.ImageHeader;
import ca.gc.cra.veil.domain.image.RgbImage;
import ca.gc.cra.veil.domain.util.Utf8;
import ca.gc.cra.veil.logging.Logs;
import ca.gc.cra.veil.util.PathUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Hides a text, file or image payload in a carrier image and writes the stego image.
 * <p><strong>Role:</strong> Application-layer use case behind {@code veil hide}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load carrier and payload through the ports.</li>
 *   <li>Pick image parameters automatically when no depths are given.</li>
 *   <li>Run the matching engine and write the result as PNG.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable collaborators.</p>
 * <p><strong>Observability:</strong> Puts the carrier path in MDC key {@code veil.carrier}; never
 * logs message text.</p>
 *
 * @since 0.1.0
 */
public final class HideUseCase {
  private static final Logger log = LoggerFactory.getLogger(HideUseCase.class);

  private final TextEmbedder textEmbedder;
  private final BlobEmbedder blobEmbedder;
  private final AdaptiveImageEmbedder imageEmbedder;
  private final ParameterAdvisor advisor;
  private final ImageCodecPort images;
  private final PayloadFilePort files;
  private final CodecConfig codecConfig;

  /**
   * Creates the use case.
   *
   * @param textEmbedder text engine
   * @param blobEmbedder file engine
   * @param imageEmbedder image engine
   * @param advisor parameter advisor matching the image engine's header region
   * @param images image codec port
   * @param files payload file port
   * @param codecConfig codec constants, used for default depths
   */
  public HideUseCase(
      TextEmbedder textEmbedder,
      BlobEmbedder blobEmbedder,
      AdaptiveImageEmbedder imageEmbedder,
      ParameterAdvisor advisor,
      ImageCodecPort images,
      PayloadFilePort files,
      CodecConfig codecConfig) {
    this.textEmbedder = Objects.requireNonNull(textEmbedder, "textEmbedder");
    this.blobEmbedder = Objects.requireNonNull(blobEmbedder, "blobEmbedder");
    this.imageEmbedder = Objects.requireNonNull(imageEmbedder, "imageEmbedder");
    this.advisor = Objects.requireNonNull(advisor, "advisor");
    this.images = Objects.requireNonNull(images, "images");
    this.files = Objects.requireNonNull(files, "files");
    this.codecConfig = Objects.requireNonNull(codecConfig, "codecConfig");
  }

  /**
   * Runs one hide.
   *
   * @param config hide configuration
   * @return output path and parameters used
   * @throws IOException if an input cannot be read or the output cannot be written
   * @throws StegoException if the payload does not fit or its header is too large
   */
  public HideResult run(HideConfig config) throws IOException, StegoException {
    Objects.requireNonNull(config, "config");
    MDC.put("veil.carrier", config.carrier().toString());
    try {
      RgbImage carrier = images.read(config.carrier());
      log.debug("Loaded carrier {}x{} ({} slots)", carrier.width(), carrier.height(), carrier.channelCount());
      Path output = config.effectiveOutput();
      HideResult result = switch (config.type()) {
        case TEXT -> hideText(carrier, config.message().orElseThrow(), output);
        case FILE -> hideFile(carrier, config.secret().orElseThrow(), output);
        case IMAGE -> hideImage(carrier, config, output);
      };
      log.info("Hid {} payload ({} bytes) in {}", config.type(), result.payloadBytes(), output);
      return result;
    } finally {
      MDC.remove("veil.carrier");
    }
  }

  private HideResult hideText(RgbImage carrier, String message, Path output)
      throws IOException, StegoException {
    log.debug("Hiding message {}", Logs.redact(message));
    RgbImage stego = textEmbedder.hide(carrier, message);
    images.write(stego, output);
    return new HideResult(PayloadType.TEXT, output, Utf8.encode(message).length, Optional.empty());
  }

  private HideResult hideFile(RgbImage carrier, Path secret, Path output) throws IOException, StegoException {
    byte[] data = files.read(secret);
    String name = PathUtils.fileName(secret).orElse("payload");
    log.debug("Hiding file {} ({} bytes, {} bits available)",
        Logs.truncate(name, 128), data.length, blobEmbedder.availableBits(carrier));
    RgbImage stego = blobEmbedder.hide(carrier, name, data);
    images.write(stego, output);
    return new HideResult(PayloadType.FILE, output, data.length, Optional.empty());
  }

  private HideResult hideImage(RgbImage carrier, HideConfig config, Path output)
      throws IOException, StegoException {
    RgbImage payload = images.read(config.secret().orElseThrow());
    ImageEmbedParameters params = resolveParameters(carrier, payload, config);
    double optimal = advisor.optimalStride(carrier, payload, params.lsb(), params.msb());
    double stride = params.stride().orElse(optimal);
    if (params.stride().isPresent()) {
      ParameterAdvisor.StrideRange range = advisor.recommendedStrideRange(optimal);
      if (!range.contains(stride)) {
        log.warn("Stride {} is outside the recommended range [{}, {}] (optimal {})",
            stride, range.min(), range.max(), optimal);
      }
    }
    log.debug("Hiding {}x{} image with lsb={}, msb={}, stride={}",
        payload.width(), payload.height(), params.lsb(), params.msb(), stride);
    RgbImage stego = imageEmbedder.hide(carrier, payload, params);
    images.write(stego, output);
    ImageHeader header = new ImageHeader(payload.width(), payload.height(), params.lsb(), params.msb(), stride);
    return new HideResult(PayloadType.IMAGE, output, payload.channelCount(), Optional.of(header));
  }

  private ImageEmbedParameters resolveParameters(RgbImage carrier, RgbImage payload, HideConfig config)
      throws CapacityExceededException {
    if (config.automaticDepths()) {
      ImageEmbedParameters chosen = advisor.findOptimal(carrier, payload)
          .orElseThrow(() -> new CapacityExceededException(
              CapacityCalculator.imageRequiredBits(payload.pixelCount(), 1),
              CapacityCalculator.imageAvailableBits(carrier.channelCount(), imageEmbedder.headerSlots(), 8)));
      log.info("Automatic parameters: lsb={}, msb={}", chosen.lsb(), chosen.msb());
      return chosen;
    }
    int lsb = config.lsb().orElse(codecConfig.defaultLsb());
    int msb = config.msb().orElse(codecConfig.defaultMsb());
    return new ImageEmbedParameters(lsb, msb, config.stride());
  }
}
