package com.scrib.markup.delta;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One insert operation of a Delta document.
 *
 * @param insert     the inserted text
 * @param attributes the formatting, null when unformatted
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"insert", "attributes"})
public record DeltaOp(@JsonProperty("insert") String insert,
                      @JsonProperty("attributes") DeltaAttributes attributes) {
}
