package com.scrib.markup.delta;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Attribute map of a Delta operation. Inline keys appear on text inserts, block keys on the
 * newline insert that ends a paragraph. Absent keys are omitted from the JSON.
 *
 * @param bold       bold text
 * @param italic     italic text
 * @param underline  underlined text
 * @param strike     struck-through text
 * @param font       font family
 * @param size       font size in points
 * @param header     heading level 1..6
 * @param blockquote block quote paragraph
 * @param list       {@code "bullet"} or {@code "ordered"}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeltaAttributes(@JsonProperty("bold") Boolean bold,
                              @JsonProperty("italic") Boolean italic,
                              @JsonProperty("underline") Boolean underline,
                              @JsonProperty("strike") Boolean strike,
                              @JsonProperty("font") String font,
                              @JsonProperty("size") Double size,
                              @JsonProperty("header") Integer header,
                              @JsonProperty("blockquote") Boolean blockquote,
                              @JsonProperty("list") String list) {
}
