package com.gentoro.kbgen.messages;

public record PhrasedQuestion(
    @FieldDoc(description = "Index of the fact this question asks about", required = true)
        int index,
    @FieldDoc(description = "Natural language question", required = true) String question) {}
