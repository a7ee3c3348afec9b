package com.scrib.markup.delta;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scrib.markup.model.BlockAttributes;
import com.scrib.markup.model.BlockMarker;
import com.scrib.markup.model.Document;
import com.scrib.markup.model.DocumentElement;
import com.scrib.markup.model.InlineAttributes;
import com.scrib.markup.model.ListKind;
import com.scrib.markup.model.StyledRun;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between {@link Document} and the editor's Delta JSON: an array of
 * {@code {"insert": ..., "attributes": {...}}} operations. A lone {@code "\n"} insert is a
 * paragraph terminator and carries the block attributes.
 * <p>
 * Reading is lenient about content: embeds (non-string inserts) are dropped, sizes may be
 * numbers or strings such as {@code "14px"}, and unsupported attribute values are ignored.
 * Only JSON that does not parse, or is not an array, is rejected.
 */
@Singleton
public class DeltaCodec {

  private static final Logger log = LoggerFactory.getLogger(DeltaCodec.class);

  private static final String NEWLINE = "\n";

  private final ObjectMapper objectMapper;

  @Inject
  public DeltaCodec(final ObjectMapper objectMapper) {
    log.info("DeltaCodec({})", objectMapper);
    this.objectMapper = objectMapper;
  }

  public DeltaCodec() {
    this(new ObjectMapper());
  }

  /**
   * Writes a document as a Delta JSON array.
   *
   * @param document the document
   * @return the JSON text
   */
  public String toDelta(final Document document) {
    Objects.requireNonNull(document, "document");
    return writeTree(toOps(document));
  }

  /**
   * Writes a document as a Delta JSON tree, for embedding in a larger JSON value.
   *
   * @param document the document
   * @return the JSON array node
   */
  public JsonNode toDeltaTree(final Document document) {
    Objects.requireNonNull(document, "document");
    return objectMapper.valueToTree(toOps(document));
  }

  /**
   * Reads a Delta JSON array.
   *
   * @param json the JSON text
   * @return the document
   * @throws IllegalArgumentException if the text is not a JSON array
   */
  public Document fromDelta(final String json) {
    Objects.requireNonNull(json, "json");
    final JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid Delta JSON", e);
    }
    return fromDeltaTree(root);
  }

  /**
   * Reads an already parsed Delta array.
   *
   * @param root the array node
   * @return the document
   * @throws IllegalArgumentException if the node is not an array
   */
  public Document fromDeltaTree(final JsonNode root) {
    if (root == null || !root.isArray()) {
      throw new IllegalArgumentException("Delta JSON must be an array of operations");
    }
    List<DocumentElement> elements = new ArrayList<>();
    for (JsonNode op : root) {
      JsonNode insert = op.get("insert");
      if (insert == null || !insert.isTextual()) {
        log.debug("fromDelta(): skipping non-text insert");
        continue;
      }
      String text = insert.asText();
      JsonNode attributes = op.get("attributes");
      if (NEWLINE.equals(text)) {
        elements.add(new BlockMarker(readBlock(attributes)));
      } else if (!text.isEmpty()) {
        elements.add(new StyledRun(text, readInline(attributes)));
      }
    }
    return new Document(elements);
  }

  private List<DeltaOp> toOps(Document document) {
    List<DeltaOp> ops = new ArrayList<>();
    for (DocumentElement element : document.elements()) {
      if (element instanceof StyledRun) {
        StyledRun run = (StyledRun) element;
        ops.add(new DeltaOp(run.text(), inline(run.attributes())));
      } else {
        ops.add(new DeltaOp(NEWLINE, block(((BlockMarker) element).attributes())));
      }
    }
    return ops;
  }

  private String writeTree(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to write Delta JSON", e);
    }
  }

  private static DeltaAttributes inline(InlineAttributes a) {
    if (a.isEmpty()) {
      return null;
    }
    return new DeltaAttributes(trueOrNull(a.bold()), trueOrNull(a.italic()), trueOrNull(a.underline()),
        trueOrNull(a.strike()), a.font(), a.sizePt(), null, null, null);
  }

  private static DeltaAttributes block(BlockAttributes a) {
    if (a.isEmpty()) {
      return null;
    }
    return new DeltaAttributes(null, null, null, null, null, null, a.headingLevel(),
        trueOrNull(a.blockquote()), a.listKind() == null ? null : a.listKind().wireName());
  }

  private static Boolean trueOrNull(boolean value) {
    return value ? Boolean.TRUE : null;
  }

  private static InlineAttributes readInline(JsonNode attributes) {
    if (attributes == null || !attributes.isObject()) {
      return InlineAttributes.NONE;
    }
    JsonNode font = attributes.get("font");
    return InlineAttributes.builder()
        .bold(attributes.path("bold").asBoolean(false))
        .italic(attributes.path("italic").asBoolean(false))
        .underline(attributes.path("underline").asBoolean(false))
        .strike(attributes.path("strike").asBoolean(false))
        .font(font != null && font.isTextual() ? font.asText() : null)
        .sizePt(readSize(attributes.get("size")))
        .build();
  }

  static Double readSize(JsonNode size) {
    if (size == null) {
      return null;
    }
    double value;
    if (size.isNumber()) {
      value = size.asDouble();
    } else if (size.isTextual()) {
      String text = size.asText().trim();
      if (text.endsWith("px")) {
        text = text.substring(0, text.length() - 2).trim();
      }
      try {
        value = Double.parseDouble(text);
      } catch (NumberFormatException e) {
        log.debug("fromDelta(): ignoring size '{}'", text);
        return null;
      }
    } else {
      return null;
    }
    return value > 0 && !Double.isInfinite(value) ? value : null;
  }

  private static BlockAttributes readBlock(JsonNode attributes) {
    if (attributes == null || !attributes.isObject()) {
      return BlockAttributes.NONE;
    }
    Integer header = null;
    JsonNode headerNode = attributes.get("header");
    if (headerNode != null && headerNode.canConvertToInt()) {
      int level = headerNode.asInt();
      if (level >= 1 && level <= BlockAttributes.MAX_HEADING_LEVEL) {
        header = level;
      }
    }
    JsonNode list = attributes.get("list");
    ListKind listKind = list != null && list.isTextual()
        ? ListKind.fromWireName(list.asText()).orElse(null)
        : null;
    return new BlockAttributes(header, attributes.path("blockquote").asBoolean(false), listKind);
  }
}
