package io.github.fiserro.homeheat.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON codec of {@link ControllerSnapshot}.
 *
 * <p>Unknown properties are ignored so that older code can read newer snapshots of the same
 * version; a snapshot of a newer version is rejected.
 */
@Slf4j
public class SnapshotCodec {

  private final ObjectMapper objectMapper = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  public String write(ControllerSnapshot snapshot) {
    try {
      return objectMapper.writeValueAsString(snapshot);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Cannot serialize controller snapshot", e);
    }
  }

  public ControllerSnapshot read(String json) throws IOException {
    return checkVersion(objectMapper.readValue(json, ControllerSnapshot.class));
  }

  public ControllerSnapshot read(InputStream json) throws IOException {
    return checkVersion(objectMapper.readValue(json, ControllerSnapshot.class));
  }

  private ControllerSnapshot checkVersion(ControllerSnapshot snapshot) throws IOException {
    if (snapshot.version() > ControllerSnapshot.CURRENT_VERSION) {
      throw new IOException("Unsupported snapshot version " + snapshot.version()
          + ", expected at most " + ControllerSnapshot.CURRENT_VERSION);
    }
    log.debug("Read snapshot v{} saved at {} with {} zones", snapshot.version(),
        snapshot.savedAt(), snapshot.zones().size());
    return snapshot;
  }
}
