package com.gentoro.kbgen.messages;

import java.util.List;

public record EdgePlan(
    @FieldDoc(description = "Directed relationships; no self-loops or duplicates", required = true)
        List<PlannedEdge> edges) {}
