package ca.gc.cra.veil.domain.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Strict UTF-8 helpers for text recovered from carrier bits.
 * <p><strong>Why:</strong> A lenient decode would replace damaged bytes with U+FFFD and hide a
 * corrupt header or message; recovered text must either decode exactly or fail.</p>
 * <p><strong>Thread-safety:</strong> Stateless; a fresh decoder is created per call.</p>
 *
 * @since 0.1.0
 */
public final class Utf8 {
  private Utf8() {}

  /**
   * Encodes text as UTF-8.
   *
   * @param text text to encode; {@code null} yields an empty array
   * @return encoded bytes
   */
  public static byte[] encode(String text) {
    return text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Decodes a UTF-8 slice, rejecting malformed or unmappable input.
   *
   * @param data backing array
   * @param offset starting offset within the array
   * @param length number of bytes to decode
   * @return decoded string
   * @throws CharacterCodingException if the bytes are not valid UTF-8
   */
  public static String decodeStrict(byte[] data, int offset, int length) throws CharacterCodingException {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    return decoder.decode(ByteBuffer.wrap(data, offset, length)).toString();
  }

  /**
   * Decodes a whole array, rejecting malformed or unmappable input.
   *
   * @param data bytes to decode
   * @return decoded string
   * @throws CharacterCodingException if the bytes are not valid UTF-8
   */
  public static String decodeStrict(byte[] data) throws CharacterCodingException {
    return decodeStrict(data, 0, data.length);
  }
}
