package com.gentoro.kbgen.messages;

import java.util.List;

/** Replacement value for a fact plus the ways a user would ask for that change. */
public record UpdatePhrasing(
    @FieldDoc(description = "New value; must differ from the current one", required = true)
        String newValue,
    @FieldDoc(
            description = "First-person requests asking the assistant to record the change",
            required = true)
        List<String> utterances) {}
