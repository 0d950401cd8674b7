package com.gentoro.gateway.attachment;

import com.gentoro.gateway.exception.ValidationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URLConnection;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;

/**
 * Turns uploaded bytes into a base64 {@code data:} URL.
 *
 * <p>The MIME type is sniffed from the content first; a known file extension then overrides it,
 * since sniffing cannot tell text formats apart.
 */
public final class AttachmentEncoder {
  private static final org.slf4j.Logger log =
      com.gentoro.gateway.logging.LoggingService.getLogger(AttachmentEncoder.class);
  static final String TEXT_PLAIN_UTF8 = "text/plain; charset=utf-8";
  static final String OCTET_STREAM = "application/octet-stream";

  private static final Map<String, String> BY_EXTENSION =
      Map.ofEntries(
          Map.entry("json", "application/json"),
          Map.entry("txt", "text/plain"),
          Map.entry("html", "text/html"),
          Map.entry("htm", "text/html"),
          Map.entry("csv", "text/csv"),
          Map.entry("xml", "application/xml"),
          Map.entry("yaml", "application/x-yaml"),
          Map.entry("yml", "application/x-yaml"),
          Map.entry("md", "text/markdown"),
          Map.entry("pdf", "application/pdf"));

  private AttachmentEncoder() {}

  public static EncodedAttachment encode(String filename, byte[] bytes) {
    if (bytes == null) {
      throw new ValidationException("Attachment content is required");
    }
    String mimeType = mimeTypeFor(filename, bytes);
    String url = "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(bytes);
    log.debug("Encoded attachment '{}' ({} bytes, {})", filename, bytes.length, mimeType);
    return new EncodedAttachment(url, mimeType, filename, bytes.length);
  }

  static String mimeTypeFor(String filename, byte[] bytes) {
    String byExtension = BY_EXTENSION.get(extension(filename));
    return byExtension != null ? byExtension : sniff(bytes);
  }

  static String sniff(byte[] bytes) {
    try {
      String guessed = URLConnection.guessContentTypeFromStream(new ByteArrayInputStream(bytes));
      if (guessed != null) {
        return guessed;
      }
    } catch (IOException e) {
      log.debug("Content type detection failed: {}", e.getMessage());
    }
    return isText(bytes) ? TEXT_PLAIN_UTF8 : OCTET_STREAM;
  }

  private static boolean isText(byte[] bytes) {
    try {
      String text =
          StandardCharsets.UTF_8
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(ByteBuffer.wrap(bytes))
              .toString();
      return text.chars().noneMatch(c -> c < 0x20 && c != '\n' && c != '\r' && c != '\t');
    } catch (CharacterCodingException e) {
      return false;
    }
  }

  private static String extension(String filename) {
    if (filename == null) return "";
    int dot = filename.lastIndexOf('.');
    return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
