package com.gentoro.kbgen.messages;

import java.util.List;

public record PhrasedQuestions(
    @FieldDoc(description = "Exactly one question per fact, in fact order", required = true)
        List<PhrasedQuestion> questions) {}
