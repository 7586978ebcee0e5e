package com.gentoro.kbgen.messages;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.kbgen.exception.ValidationException;
import com.gentoro.kbgen.utility.JacksonUtility;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Derives JSON schemas from {@link FieldDoc}-annotated records and checks parsed instances
 * against the {@code required} flags.
 */
public class JsonSchemaGenerator {

  public static ObjectNode generateSchema(Class<?> clazz) {
    if (!clazz.isRecord()) {
      throw new ValidationException("Schema classes must be records: " + clazz.getName());
    }
    ObjectNode schema = JacksonUtility.getJsonMapper().createObjectNode();
    schema.put("type", "object");
    ObjectNode props = schema.putObject("properties");
    ArrayNode required = schema.putArray("required");
    for (RecordComponent rc : clazz.getRecordComponents()) {
      FieldDoc doc = rc.getAnnotation(FieldDoc.class);
      ObjectNode prop = props.putObject(rc.getName());
      describeType(prop, rc.getType(), rc.getGenericType());
      if (doc != null) {
        if (!doc.description().isEmpty()) prop.put("description", doc.description());
        if (!doc.example().isEmpty()) prop.put("example", doc.example());
        if (doc.required()) required.add(rc.getName());
      }
    }
    schema.put("additionalProperties", false);
    return schema;
  }

  /** Pretty printed schema, ready to be embedded in a prompt. */
  public static String describe(Class<?> clazz) {
    return JacksonUtility.toJson(generateSchema(clazz));
  }

  /**
   * Paths of required components that are null, blank or empty, e.g. {@code
   * people[2].name}. Nested records and lists of records are checked recursively.
   */
  public static List<String> missingRequired(Object instance) {
    List<String> out = new ArrayList<>();
    collectMissing(instance, "", out);
    return out;
  }

  private static void collectMissing(Object instance, String prefix, List<String> out) {
    if (instance == null || !instance.getClass().isRecord()) return;
    for (RecordComponent rc : instance.getClass().getRecordComponents()) {
      Object value;
      try {
        value = rc.getAccessor().invoke(instance);
      } catch (ReflectiveOperationException e) {
        throw new ValidationException("Cannot read component " + rc.getName(), e);
      }
      String path = prefix.isEmpty() ? rc.getName() : prefix + "." + rc.getName();
      FieldDoc doc = rc.getAnnotation(FieldDoc.class);
      if (doc != null && doc.required() && isMissing(value)) {
        out.add(path);
        continue;
      }
      if (value instanceof List<?> list) {
        for (int i = 0; i < list.size(); i++) {
          collectMissing(list.get(i), path + "[" + i + "]", out);
        }
      } else {
        collectMissing(value, path, out);
      }
    }
  }

  private static boolean isMissing(Object value) {
    if (value == null) return true;
    if (value instanceof String s) return s.isBlank();
    if (value instanceof Collection<?> c) return c.isEmpty();
    return false;
  }

  private static void describeType(ObjectNode prop, Class<?> type, Type generic) {
    if (String.class.equals(type)) {
      prop.put("type", "string");
    } else if (Integer.class.equals(type)
        || int.class.equals(type)
        || Long.class.equals(type)
        || long.class.equals(type)) {
      prop.put("type", "integer");
    } else if (Number.class.isAssignableFrom(type) || type.isPrimitive() && type != boolean.class) {
      prop.put("type", "number");
    } else if (Boolean.class.equals(type) || boolean.class.equals(type)) {
      prop.put("type", "boolean");
    } else if (Collection.class.isAssignableFrom(type)) {
      prop.put("type", "array");
      ObjectNode items = prop.putObject("items");
      if (generic instanceof ParameterizedType p
          && p.getActualTypeArguments().length == 1
          && p.getActualTypeArguments()[0] instanceof Class<?> c) {
        if (c.isRecord()) {
          items.setAll(generateSchema(c));
        } else {
          describeType(items, c, c);
        }
      }
    } else if (type.isRecord()) {
      prop.setAll(generateSchema(type));
    } else if (Map.class.isAssignableFrom(type)) {
      prop.put("type", "object");
    } else {
      ArrayNode anyOf = prop.putArray("type");
      anyOf.add("string").add("number").add("boolean");
    }
  }
}
