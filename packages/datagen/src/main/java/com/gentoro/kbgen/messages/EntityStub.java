package com.gentoro.kbgen.messages;

public record EntityStub(
    @FieldDoc(description = "Short unique identifier, e.g. e1", required = true) String id,
    @FieldDoc(description = "Display name", required = true) String name,
    @FieldDoc(
            description = "Kind of entity in snake_case",
            example = "restaurant",
            required = true)
        String entityType) {}
