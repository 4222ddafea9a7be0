package ca.gc.cra.dart.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Log hygiene helpers.
 *
 * <p>Input log lines and trace payloads are echoed into diagnostics only through {@link #truncate(String, int)},
 * which keeps a single pathological line from flooding the operator log.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to at most {@code maxBytes} UTF-8 bytes, marking the cut.
   *
   * @param value text to shorten; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return the value unchanged when it fits, otherwise the prefix followed by {@code "... (truncated, X of Y bytes)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    String prefix;
    try {
      // IGNORE drops a code point split at the boundary
      CharBuffer decoded = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.IGNORE)
          .onUnmappableCharacter(CodingErrorAction.IGNORE)
          .decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      prefix = decoded.toString();
    } catch (CharacterCodingException ex) {
      prefix = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
    return prefix + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
  }
}
