package ca.gc.cra.veil.infrastructure.report;

import ca.gc.cra.veil.application.pipeline.CapacitySummary;
import ca.gc.cra.veil.domain.capacity.CapacityReport;
import ca.gc.cra.veil.domain.capacity.ImageCapacityEstimate;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * <strong>What:</strong> Renders a {@link CapacitySummary} as a JSON document.
 * <p><strong>Shape:</strong>
 * <pre>{@code
 * {"carrier":"...","width":W,"height":H,
 *  "text":{...},"file":{...},"image":[{"lsb":1,...},...]}
 * }</pre>
 * Sections that were not requested are omitted.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; {@link JsonFactory} is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CapacityReportJsonWriter {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Renders the summary.
   *
   * @param summary capacity summary
   * @return single-line JSON document
   */
  public String render(CapacitySummary summary) {
    Objects.requireNonNull(summary, "summary");
    StringWriter out = new StringWriter();
    try (JsonGenerator json = factory.createGenerator(out)) {
      json.writeStartObject();
      json.writeStringField("carrier", summary.carrier().toString());
      json.writeNumberField("width", summary.width());
      json.writeNumberField("height", summary.height());
      if (summary.text().isPresent()) {
        json.writeFieldName("text");
        writeReport(json, summary.text().get());
      }
      if (summary.file().isPresent()) {
        json.writeFieldName("file");
        writeReport(json, summary.file().get());
      }
      if (!summary.image().isEmpty()) {
        json.writeArrayFieldStart("image");
        for (ImageCapacityEstimate estimate : summary.image()) {
          json.writeStartObject();
          json.writeNumberField("lsb", estimate.lsb());
          json.writeNumberField("availableBits", estimate.availableBits());
          json.writeNumberField("availableKib", estimate.availableKib());
          json.writeNumberField("maxHiddenPixels", estimate.maxHiddenPixels());
          json.writeNumberField("maxSquareSide", estimate.maxSquareSide());
          json.writeEndObject();
        }
        json.writeEndArray();
      }
      json.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to render capacity report", ex);
    }
    return out.toString();
  }

  private static void writeReport(JsonGenerator json, CapacityReport report) throws IOException {
    json.writeStartObject();
    json.writeNumberField("bitDepth", report.bitDepth());
    json.writeNumberField("totalBits", report.totalBits());
    json.writeNumberField("reservedBits", report.reservedBits());
    json.writeNumberField("availableBits", report.availableBits());
    json.writeNumberField("availableBytes", report.availableBytes());
    json.writeNumberField("safeUsageBytes", report.safeUsageBytes());
    json.writeEndObject();
  }
}
