package com.scrib.markup.delta;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scrib.markup.model.BlockAttributes;
import com.scrib.markup.model.BlockMarker;
import com.scrib.markup.model.Document;
import com.scrib.markup.model.InlineAttributes;
import com.scrib.markup.model.ListKind;
import com.scrib.markup.model.StyledRun;
import org.junit.jupiter.api.Test;

class DeltaCodecTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final DeltaCodec codec = new DeltaCodec(objectMapper);

  // ─── Writing ──────────────────────────────────────────────────────────────

  @Test
  void toDelta_putsBlockAttributesOnNewline() throws Exception {
    Document document = Document.builder()
        .text("Hi", InlineAttributes.builder().bold(true).sizePt(14.0).build())
        .paragraph(BlockAttributes.heading(1))
        .text("item").paragraph(BlockAttributes.list(ListKind.ORDERED))
        .text("plain").paragraph()
        .build();

    String json = codec.toDelta(document);

    assertThat(objectMapper.readTree(json)).isEqualTo(objectMapper.readTree("["
        + "{\"insert\":\"Hi\",\"attributes\":{\"bold\":true,\"size\":14.0}},"
        + "{\"insert\":\"\\n\",\"attributes\":{\"header\":1}},"
        + "{\"insert\":\"item\"},"
        + "{\"insert\":\"\\n\",\"attributes\":{\"list\":\"ordered\"}},"
        + "{\"insert\":\"plain\"},"
        + "{\"insert\":\"\\n\"}]"));
  }

  @Test
  void roundTrip() {
    Document document = Document.builder()
        .text("a", new InlineAttributes(true, true, true, true, "Georgia", 11.5))
        .text("b\nc")
        .paragraph(BlockAttributes.quote())
        .text("d").paragraph(BlockAttributes.list(ListKind.BULLET))
        .build();

    assertThat(codec.fromDelta(codec.toDelta(document))).isEqualTo(document);
  }

  // ─── Reading ──────────────────────────────────────────────────────────────

  @Test
  void fromDelta_isLenientAboutContent() {
    Document document = codec.fromDelta("["
        + "{\"insert\":\"a\",\"attributes\":{\"size\":\"14px\",\"font\":\"Arial\",\"color\":\"#ff0000\"}},"
        + "{\"insert\":{\"image\":\"x.png\"}},"
        + "{\"insert\":\"b\",\"attributes\":{\"size\":\"large\",\"bold\":false}},"
        + "{\"retain\":3},"
        + "{\"insert\":\"\\n\",\"attributes\":{\"list\":\"checked\",\"header\":9}}]");

    assertThat(document.elements()).containsExactly(
        new StyledRun("a", InlineAttributes.builder().font("Arial").sizePt(14.0).build()),
        StyledRun.plain("b"),
        BlockMarker.PARAGRAPH);
  }

  @Test
  void fromDelta_numericSize() {
    Document document = codec.fromDelta("[{\"insert\":\"x\",\"attributes\":{\"size\":12}},{\"insert\":\"\\n\"}]");
    assertThat(((StyledRun) document.elements().get(0)).attributes().sizePt()).isEqualTo(12.0);
  }

  @Test
  void fromDelta_rejectsBrokenJson() {
    assertThatThrownBy(() -> codec.fromDelta("[{\"insert\":"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> codec.fromDelta("{\"ops\":[]}"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void fromDelta_emptyArray() {
    assertThat(codec.fromDelta("[]").elements()).isEmpty();
  }
}
