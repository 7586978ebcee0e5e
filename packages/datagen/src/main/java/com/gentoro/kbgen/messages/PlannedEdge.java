package com.gentoro.kbgen.messages;

public record PlannedEdge(
    @FieldDoc(description = "Id (or exact name) of the subject node", required = true)
        String subjectId,
    @FieldDoc(
            description = "Relationship label in snake_case",
            example = "works_at",
            required = true)
        String predicate,
    @FieldDoc(description = "Id (or exact name) of the object node", required = true)
        String objectId) {}
