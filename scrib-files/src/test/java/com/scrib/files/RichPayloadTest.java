package com.scrib.files;

import static org.assertj.core.api.Assertions.assertThat;

import com.scrib.files.model.EditorContent;
import com.scrib.markup.model.BlockAttributes;
import com.scrib.markup.model.Document;
import com.scrib.markup.model.InlineAttributes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RichPayloadTest {

  private final RichPayload payload = new RichPayload();

  @Test
  void wrap_producesEnvelope() {
    Document document = Document.builder().text("Title").paragraph(BlockAttributes.heading(1)).build();

    assertThat(payload.wrap(document)).isEqualTo(
        "{\"scrib_rich\":[{\"insert\":\"Title\"},{\"insert\":\"\\n\",\"attributes\":{\"header\":1}}]}");
  }

  @Test
  void unwrap_envelopeIsRich() {
    Document document = Document.builder()
        .text("bold", InlineAttributes.builder().bold(true).build()).paragraph()
        .build();

    EditorContent content = payload.unwrap(payload.wrap(document));

    assertThat(content.isRich()).isTrue();
    assertThat(content.document()).isEqualTo(document);
    assertThat(content.plainText()).isEqualTo("bold\n");
  }

  @Test
  void unwrap_otherTextIsPlain() {
    EditorContent content = payload.unwrap("{\"other\":1}");
    assertThat(content.isRich()).isFalse();
    assertThat(content.plainText()).isEqualTo("{\"other\":1}");
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "{\"scrib_rich\":[",
      "{\"scrib_rich\":null}",
      "{\"scrib_rich\":\"text\"}"
  })
  void unwrap_brokenEnvelopeFallsBackToPlain(String text) {
    EditorContent content = payload.unwrap(text);
    assertThat(content.mode()).isEqualTo(EditorContent.Mode.PLAIN_TEXT);
    assertThat(content.plainText()).isEqualTo(text);
  }
}
