package ca.gc.cra.veil.application.pipeline;

import ca.gc.cra.veil.application.port.ImageCodecPort;
import ca.gc.cra.veil.application.port.PayloadFilePort;
import ca.gc.cra.veil.config.ExtractConfig;
import ca.gc.cra.veil.config.PayloadType;
import ca.gc.cra.veil.domain.codec.AdaptiveImageEmbedder;
import ca.gc.cra.veil.domain.codec.BlobEmbedder;
import ca.gc.cra.veil.domain.codec.RecoveredBlob;
import ca.gc.cra.veil.domain.codec.RecoveredImage;
import ca.gc.cra.veil.domain.codec.TextEmbedder;
import ca.gc.cra.veil.domain.error.StegoException;
import ca.gc.cra.veil.domain.image.RgbImage;
import ca.gc.cra.veil.domain.util.Utf8;
import ca.gc.cra.veil.logging.Logs;
import ca.gc.cra.veil.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Recovers a hidden payload from a stego image.
 * <p><strong>Role:</strong> Application-layer use case behind {@code veil extract}.</p>
 * <p><strong>Outputs:</strong> text is returned in the result; files are written as
 * {@code recovered_<name>} in the output directory; images are written as PNG.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable collaborators.</p>
 *
 * @since 0.1.0
 */
public final class ExtractUseCase {
  private static final Logger log = LoggerFactory.getLogger(ExtractUseCase.class);

  private final TextEmbedder textEmbedder;
  private final BlobEmbedder blobEmbedder;
  private final AdaptiveImageEmbedder imageEmbedder;
  private final ImageCodecPort images;
  private final PayloadFilePort files;

  /**
   * Creates the use case.
   *
   * @param textEmbedder text engine
   * @param blobEmbedder file engine
   * @param imageEmbedder image engine
   * @param images image codec port
   * @param files payload file port
   */
  public ExtractUseCase(
      TextEmbedder textEmbedder,
      BlobEmbedder blobEmbedder,
      AdaptiveImageEmbedder imageEmbedder,
      ImageCodecPort images,
      PayloadFilePort files) {
    this.textEmbedder = Objects.requireNonNull(textEmbedder, "textEmbedder");
    this.blobEmbedder = Objects.requireNonNull(blobEmbedder, "blobEmbedder");
    this.imageEmbedder = Objects.requireNonNull(imageEmbedder, "imageEmbedder");
    this.images = Objects.requireNonNull(images, "images");
    this.files = Objects.requireNonNull(files, "files");
  }

  /**
   * Runs one extraction.
   *
   * @param config extract configuration
   * @param allowOverwrite whether existing output files may be replaced
   * @return recovered message or written output
   * @throws IOException if the carrier cannot be read or an output cannot be written
   * @throws StegoException if the carrier holds no valid payload of the requested type
   */
  public ExtractResult run(ExtractConfig config, boolean allowOverwrite) throws IOException, StegoException {
    Objects.requireNonNull(config, "config");
    MDC.put("veil.carrier", config.carrier().toString());
    try {
      RgbImage carrier = images.read(config.carrier());
      ExtractResult result = switch (config.type()) {
        case TEXT -> extractText(carrier);
        case FILE -> extractFile(carrier, config.effectiveOutputDirectory(), allowOverwrite);
        case IMAGE -> extractImage(carrier, config.effectiveImageOutput(), allowOverwrite);
      };
      log.info("Recovered {} payload ({} bytes)", config.type(), result.payloadBytes());
      return result;
    } finally {
      MDC.remove("veil.carrier");
    }
  }

  private ExtractResult extractText(RgbImage carrier) throws StegoException {
    String message = textEmbedder.extract(carrier);
    log.debug("Recovered message {}", Logs.redact(message));
    return new ExtractResult(
        PayloadType.TEXT, Optional.of(message), Optional.empty(), Utf8.encode(message).length, Optional.empty());
  }

  private ExtractResult extractFile(RgbImage carrier, Path directory, boolean allowOverwrite)
      throws IOException, StegoException {
    RecoveredBlob blob = blobEmbedder.extract(carrier);
    log.debug("Header names file {} ({} bytes)", Logs.truncate(blob.name(), 128), blob.size());
    Path target = Paths.validateWritableDir(directory, true);
    Path written = files.writeRecovered(target, blob.name(), blob.data(), allowOverwrite);
    return new ExtractResult(PayloadType.FILE, Optional.empty(), Optional.of(written), blob.size(), Optional.empty());
  }

  private ExtractResult extractImage(RgbImage carrier, Path output, boolean allowOverwrite)
      throws IOException, StegoException {
    RecoveredImage recovered = imageEmbedder.extract(carrier);
    log.debug("Header declares {}", recovered.header());
    Path target = Paths.validateOutputFile("out", output, allowOverwrite, true);
    images.write(recovered.image(), target);
    return new ExtractResult(
        PayloadType.IMAGE,
        Optional.empty(),
        Optional.of(target),
        recovered.image().channelCount(),
        Optional.of(recovered.header()));
  }
}
