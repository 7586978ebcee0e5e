package com.gentoro.kbgen.render;

import java.util.Objects;

/**
 * One labeled line of a rendered document.
 *
 * @param section heading the field is grouped under
 * @param name attribute key or relationship label, verbatim
 * @param value display value; for relationships the target's name
 * @param link key of the linked document, or {@code null} for plain attribute fields
 */
public record DocumentField(String section, String name, String value, String link) {
  public DocumentField {
    Objects.requireNonNull(section, "section");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(value, "value");
  }

  public static DocumentField attribute(String section, String name, String value) {
    return new DocumentField(section, name, value, null);
  }

  public boolean hasLink() {
    return link != null;
  }
}
