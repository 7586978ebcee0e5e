package com.gentoro.kbgen.query;

/** Fewer facts existed at {@code hop} than were requested. */
public record Shortfall(int hop, int requested, int available) {}
