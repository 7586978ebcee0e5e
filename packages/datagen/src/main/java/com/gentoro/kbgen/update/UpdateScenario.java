package com.gentoro.kbgen.update;

import com.gentoro.kbgen.diff.DocumentDiff;
import com.gentoro.kbgen.render.DocumentSet;
import java.util.List;

/**
 * One simulated knowledge-base edit and its effect on the rendered documents.
 *
 * @param focalNodeId person whose neighborhood was edited
 * @param kind attribute or relationship change
 * @param hopDistance shortest-path distance from the focal node to the changed node
 * @param changedNodeId node whose attribute or outgoing edge changed
 * @param changedDocumentKey key of that node's document
 * @param changedField attribute key or relation label
 * @param placeholderNodeId node created as the new relationship target, {@code null} for
 *     attribute changes
 * @param oldPath names from the focal node to the changed fact, before the edit
 * @param newPath same path after the edit
 * @param oldValue previous attribute value or target name
 * @param newValue new attribute value or target name
 * @param utterances user requests asking for the edit
 * @param diff structural diff from the original to the updated documents
 * @param updatedDocuments documents rendered from the edited graph
 */
public record UpdateScenario(
    String focalNodeId,
    UpdateKind kind,
    int hopDistance,
    String changedNodeId,
    String changedDocumentKey,
    String changedField,
    String placeholderNodeId,
    List<String> oldPath,
    List<String> newPath,
    String oldValue,
    String newValue,
    List<String> utterances,
    DocumentDiff diff,
    DocumentSet updatedDocuments) {
  public UpdateScenario {
    oldPath = List.copyOf(oldPath);
    newPath = List.copyOf(newPath);
    utterances = List.copyOf(utterances);
  }
}
