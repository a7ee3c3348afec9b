package com.scrib.markup;

import com.scrib.markup.model.Document;
import com.scrib.markup.rtf.RtfReader;
import com.scrib.markup.rtf.RtfWriter;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between the in-memory {@link Document} and the rich-text markup stored in
 * {@code .rtf} files. Reading never fails on malformed markup.
 */
@Singleton
public class RichMarkupCodec {

  private static final Logger log = LoggerFactory.getLogger(RichMarkupCodec.class);

  private final RtfWriter writer;
  private final RtfReader reader;

  @Inject
  public RichMarkupCodec(final RtfWriter writer, final RtfReader reader) {
    log.info("RichMarkupCodec({}, {})", writer, reader);
    this.writer = writer;
    this.reader = reader;
  }

  public RichMarkupCodec() {
    this(new RtfWriter(), new RtfReader());
  }

  /**
   * Serializes a document to markup.
   *
   * @param document the document
   * @return the markup text
   */
  public String toExternal(final Document document) {
    Objects.requireNonNull(document, "document");
    log.debug("toExternal(elements={})", document.elements().size());
    return writer.write(document);
  }

  /**
   * Parses markup into a document. Text without the markup signature becomes a single
   * unformatted paragraph.
   *
   * @param markup the markup text
   * @return the document, always newline-terminated
   */
  public Document toInternal(final String markup) {
    Objects.requireNonNull(markup, "markup");
    log.debug("toInternal(length={})", markup.length());
    return reader.read(markup);
  }
}
