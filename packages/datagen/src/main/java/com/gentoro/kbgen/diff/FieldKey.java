package com.gentoro.kbgen.diff;

import com.gentoro.kbgen.render.DocumentField;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Identity of a field inside one document: section, name and the occurrence number among fields
 * sharing that section and name (a person can {@code know} several people).
 */
public record FieldKey(String section, String name, int ordinal) {

  static List<FieldKey> keysOf(List<DocumentField> fields) {
    Map<String, Integer> seen = new HashMap<>();
    List<FieldKey> out = new ArrayList<>(fields.size());
    for (DocumentField f : fields) {
      String id = f.section() + "\u0000" + f.name();
      int ordinal = seen.merge(id, 1, Integer::sum) - 1;
      out.add(new FieldKey(f.section(), f.name(), ordinal));
    }
    return out;
  }
}
