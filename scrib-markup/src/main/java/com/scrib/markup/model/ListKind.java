package com.scrib.markup.model;

import java.util.Optional;

/**
 * List style carried by a paragraph terminator.
 */
public enum ListKind {

  BULLET("bullet"),
  ORDERED("ordered");

  private final String wireName;

  ListKind(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Resolves the interchange name ({@code "bullet"}, {@code "ordered"}).
   *
   * @param wireName the name used in the Delta {@code list} attribute
   * @return the kind, or empty for names this model does not carry (e.g. checklists)
   */
  public static Optional<ListKind> fromWireName(String wireName) {
    for (ListKind kind : values()) {
      if (kind.wireName.equals(wireName)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }

  public String wireName() {
    return wireName;
  }
}
