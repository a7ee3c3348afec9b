package com.scrib.files;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scrib.files.model.EditorContent;
import com.scrib.markup.delta.DeltaCodec;
import com.scrib.markup.model.Document;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Marks rich documents inside an encrypted container. The plaintext of a rich save is
 * {@code {"scrib_rich":<delta>}}; anything else decrypts to plain text.
 */
@Singleton
public class RichPayload {

  private static final Logger log = LoggerFactory.getLogger(RichPayload.class);

  public static final String FIELD = "scrib_rich";
  public static final String PREFIX = "{\"" + FIELD + "\":";

  private final ObjectMapper objectMapper;
  private final DeltaCodec deltaCodec;

  @Inject
  public RichPayload(final ObjectMapper objectMapper, final DeltaCodec deltaCodec) {
    this.objectMapper = objectMapper;
    this.deltaCodec = deltaCodec;
  }

  public RichPayload() {
    this(new ObjectMapper(), new DeltaCodec());
  }

  /**
   * Wraps a document in the rich envelope.
   *
   * @param document the document
   * @return the envelope JSON
   */
  public String wrap(final Document document) {
    Objects.requireNonNull(document, "document");
    ObjectNode envelope = objectMapper.createObjectNode();
    envelope.set(FIELD, deltaCodec.toDeltaTree(document));
    try {
      return objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to write rich payload", e);
    }
  }

  /**
   * Interprets decrypted text. An envelope that does not parse is kept as plain text.
   *
   * @param plaintext the decrypted text
   * @return the content
   */
  public EditorContent unwrap(final String plaintext) {
    Objects.requireNonNull(plaintext, "plaintext");
    if (!plaintext.startsWith(PREFIX)) {
      return EditorContent.plain(plaintext);
    }
    try {
      JsonNode delta = objectMapper.readTree(plaintext).get(FIELD);
      return EditorContent.rich(deltaCodec.fromDeltaTree(delta));
    } catch (JsonProcessingException | IllegalArgumentException e) {
      log.warn("unwrap(): rich payload unreadable, opening as plain text: {}", e.getMessage());
      return EditorContent.plain(plaintext);
    }
  }
}
