package com.gentoro.kbgen.exception;

import java.util.Map;

/**
 * A rendered document links to a key that is not part of its document set. Rendering guarantees
 * closure, so this always signals an internal bug and is never patched over.
 */
public class LinkResolutionException extends KbGenException {
  public LinkResolutionException(String sourceKey, String targetKey) {
    super(
        KbGenErrorCode.LINK_RESOLUTION_ERROR,
        "Document '%s' links to missing document '%s'".formatted(sourceKey, targetKey),
        Map.of("source", sourceKey, "target", targetKey));
  }
}
