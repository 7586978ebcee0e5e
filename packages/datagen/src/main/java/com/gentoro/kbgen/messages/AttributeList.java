package com.gentoro.kbgen.messages;

import java.util.List;

public record AttributeList(
    @FieldDoc(description = "New attributes for the node", required = true)
        List<AttributePair> attributes) {}
