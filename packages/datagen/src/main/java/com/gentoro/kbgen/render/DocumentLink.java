package com.gentoro.kbgen.render;

/** Typed reference from one document to another document's key. */
public record DocumentLink(String relation, String targetKey) {}
