package com.scrib.markup.model;

/**
 * One entry of a {@link Document}: either a {@link StyledRun} or a {@link BlockMarker}.
 */
public interface DocumentElement {
}
