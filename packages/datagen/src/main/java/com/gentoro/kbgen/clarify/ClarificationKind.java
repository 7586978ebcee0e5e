package com.gentoro.kbgen.clarify;

/** Ways a question can fail to match the memory so the assistant has to ask back. */
public enum ClarificationKind {
  NON_EXISTENT_ENTITY(
      "non_existing_entity", "the question asks about an entity the memory never mentions"),
  NON_EXISTENT_ATTRIBUTE(
      "non_existing_attribute",
      "the question asks for an attribute the memory does not record for a known entity"),
  CONTRADICTION(
      "contradiction", "the question states a detail that contradicts what the memory says");

  private final String label;
  private final String description;

  ClarificationKind(String label, String description) {
    this.label = label;
    this.description = description;
  }

  /** Key used in {@code clarification_questions.json}. */
  public String label() {
    return label;
  }

  public String description() {
    return description;
  }
}
