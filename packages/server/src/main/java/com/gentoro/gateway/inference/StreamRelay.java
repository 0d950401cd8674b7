package com.gentoro.gateway.inference;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gateway.inference.protocol.InferenceTarget;
import com.gentoro.gateway.inference.protocol.ProtocolAdapter;
import com.gentoro.gateway.utility.JacksonUtility;
import java.io.IOException;
import java.util.Optional;
import okio.BufferedSource;

/**
 * Relays an upstream server-sent event stream to a {@link StreamSink}.
 *
 * <p>Only {@code data: } lines are relayed. Chunks that are not JSON are skipped; chunks the
 * adapter knows how to convert are rewritten, the rest pass through verbatim. The relay always
 * finishes with {@code data: [DONE]}, whether upstream sent it or just closed the stream.
 */
public final class StreamRelay {
  private static final org.slf4j.Logger log =
      com.gentoro.gateway.logging.LoggingService.getLogger(StreamRelay.class);
  public static final String DATA_PREFIX = "data: ";
  public static final String DONE = "[DONE]";

  private StreamRelay() {}

  public static String frame(String data) {
    return DATA_PREFIX + data + "\n\n";
  }

  /** Returns the number of chunks relayed, not counting the final {@code [DONE]}. */
  public static int relay(
      BufferedSource source, ProtocolAdapter adapter, InferenceTarget target, StreamSink sink)
      throws IOException {
    int relayed = 0;
    String line;
    while ((line = source.readUtf8Line()) != null) {
      line = line.trim();
      if (line.isEmpty() || !line.startsWith(DATA_PREFIX)) {
        continue;
      }
      String data = line.substring(DATA_PREFIX.length());
      if (DONE.equals(data)) {
        break;
      }
      JsonNode chunk;
      try {
        chunk = JacksonUtility.getJsonMapper().readTree(data);
      } catch (IOException e) {
        log.warn("Skipping unparsable stream chunk: {}", e.getMessage());
        continue;
      }
      Optional<JsonNode> converted = adapter.convertStreamChunk(chunk, target);
      sink.send(frame(converted.isPresent() ? JacksonUtility.toJson(converted.get()) : data));
      relayed++;
    }
    sink.send(frame(DONE));
    return relayed;
  }
}
