package com.gentoro.kbgen.messages;

import java.util.List;

/** People and entities of a freshly invented world, before any relationship exists. */
public record WorldStubs(
    @FieldDoc(description = "People living in the world", required = true) List<PersonStub> people,
    @FieldDoc(description = "Places, organizations and other entities")
        List<EntityStub> entities) {}
