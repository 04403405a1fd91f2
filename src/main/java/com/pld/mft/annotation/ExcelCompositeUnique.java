package com.pld.mft.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** Fields whose combined values must not repeat within one uploaded file. */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Repeatable(ExcelCompositeUniques.class)
public @interface ExcelCompositeUnique {

  String[] fields();

  String message() default "Duplicate combination";
}
