package com.gentoro.kbgen.messages;

public record PersonStub(
    @FieldDoc(description = "Short unique identifier, e.g. p1", required = true) String id,
    @FieldDoc(description = "Full name; unique among all people", required = true) String name) {}
