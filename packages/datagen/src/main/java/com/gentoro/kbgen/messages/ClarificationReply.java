package com.gentoro.kbgen.messages;

/** A question the memory cannot answer as asked, and the assistant's clarifying reply. */
public record ClarificationReply(
    @FieldDoc(description = "What the user asks", required = true) String question,
    @FieldDoc(
            description = "Assistant reply pointing out the gap or conflict and asking back",
            required = true)
        String answer,
    @FieldDoc(description = "One sentence on why the question cannot be answered as asked")
        String rationale) {}
