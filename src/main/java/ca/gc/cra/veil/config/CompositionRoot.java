package ca.gc.cra.veil.config;

import ca.gc.cra.veil.application.pipeline.CapacityUseCase;
import ca.gc.cra.veil.application.pipeline.ExtractUseCase;
import ca.gc.cra.veil.application.pipeline.HideUseCase;
import ca.gc.cra.veil.application.port.ImageCodecPort;
import ca.gc.cra.veil.application.port.PayloadFilePort;
import ca.gc.cra.veil.domain.codec.AdaptiveImageEmbedder;
import ca.gc.cra.veil.domain.codec.BlobEmbedder;
import ca.gc.cra.veil.domain.codec.ParameterAdvisor;
import ca.gc.cra.veil.domain.codec.TextEmbedder;
import ca.gc.cra.veil.infrastructure.image.ImageIoCodecAdapter;
import ca.gc.cra.veil.infrastructure.persistence.FilePayloadAdapter;
import ca.gc.cra.veil.infrastructure.report.CapacityReportJsonWriter;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires VEIL use cases to their engines and adapters.
 * <p><strong>Role:</strong> Composition root shared by the hide, extract and capacity commands.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the text, file and image engines from one {@link CodecConfig}.</li>
 *   <li>Share a single image codec and payload file adapter between use cases.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable collaborators; factory methods create new use
 * case instances.</p>
 *
 * @since 0.1.0
 * @see HideUseCase
 * @see ExtractUseCase
 * @see CapacityUseCase
 */
public final class CompositionRoot {
  private final CodecConfig codecConfig;
  private final ImageCodecPort images;
  private final PayloadFilePort files;
  private final TextEmbedder textEmbedder;
  private final BlobEmbedder blobEmbedder;
  private final AdaptiveImageEmbedder imageEmbedder;

  /**
   * Creates a composition root backed by ImageIO and the local filesystem.
   *
   * @param codecConfig codec constants
   */
  public CompositionRoot(CodecConfig codecConfig) {
    this(codecConfig, new ImageIoCodecAdapter(), new FilePayloadAdapter());
  }

  /**
   * Creates a composition root with explicit adapters.
   *
   * @param codecConfig codec constants
   * @param images image codec adapter
   * @param files payload file adapter
   */
  public CompositionRoot(CodecConfig codecConfig, ImageCodecPort images, PayloadFilePort files) {
    this.codecConfig = Objects.requireNonNull(codecConfig, "codecConfig");
    this.images = Objects.requireNonNull(images, "images");
    this.files = Objects.requireNonNull(files, "files");
    this.textEmbedder = new TextEmbedder(codecConfig.textTerminatorBits());
    this.blobEmbedder = new BlobEmbedder(codecConfig.blobHeaderBits());
    this.imageEmbedder = new AdaptiveImageEmbedder(codecConfig.imageHeaderBits());
  }

  public CodecConfig codecConfig() {
    return codecConfig;
  }

  public HideUseCase hideUseCase() {
    return new HideUseCase(
        textEmbedder,
        blobEmbedder,
        imageEmbedder,
        new ParameterAdvisor(imageEmbedder.headerSlots()),
        images,
        files,
        codecConfig);
  }

  public ExtractUseCase extractUseCase() {
    return new ExtractUseCase(textEmbedder, blobEmbedder, imageEmbedder, images, files);
  }

  public CapacityUseCase capacityUseCase() {
    return new CapacityUseCase(textEmbedder, blobEmbedder, imageEmbedder, images, codecConfig.safeUsageFraction());
  }

  public CapacityReportJsonWriter capacityReportJsonWriter() {
    return new CapacityReportJsonWriter();
  }
}
