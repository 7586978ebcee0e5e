package com.gentoro.kbgen.messages;

public record AttributePair(
    @FieldDoc(description = "Attribute name in snake_case", required = true) String key,
    @FieldDoc(description = "Scalar attribute value", required = true) Object value) {}
