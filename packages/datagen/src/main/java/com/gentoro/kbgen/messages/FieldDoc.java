package com.gentoro.kbgen.messages;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** Documents a component of a structured model response; drives the generated JSON schema. */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface FieldDoc {
  /** Example content or placeholder for the field. */
  String example() default "";

  /** A natural-language explanation of what this field represents. */
  String description() default "";

  /** Whether the field is required. Required fields must be non-null and non-blank. */
  boolean required() default false;
}
