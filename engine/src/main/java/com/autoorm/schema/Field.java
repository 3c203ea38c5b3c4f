package com.autoorm.schema;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** Field constraints for a record component picked up by {@link ModelClasses}. */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface Field {

  /** Whether no two records may share a value for this field. */
  boolean unique() default false;

  /**
   * Whether the field may be null. Only consulted for reference-typed components; primitives are
   * never nullable.
   */
  boolean nullable() default true;

  /** Default value in text form, parsed according to the field type. Empty means none. */
  String defaultValue() default "";
}
