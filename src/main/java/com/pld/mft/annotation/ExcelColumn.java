package com.pld.mft.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** Binds a row DTO field to a workbook column. */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface ExcelColumn {

  /**
   * Header text. With {@link #column()} set it is checked against the header at that position;
   * otherwise the header row is scanned for it. Also shown in error messages.
   */
  String header();

  /** Fixed column letter ("A", "AB"). Empty means auto-detect from the header row. */
  String column() default "";

  /** Pattern for LocalDate/LocalDateTime cells stored as text. */
  String dateFormat() default "yyyy-MM-dd HH:mm";

  HeaderMatchMode matchMode() default HeaderMatchMode.EXACT;

  /** Prepended to validation messages for this column. */
  String errorPrefix() default "";

  /**
   * A required column that cannot be resolved fails the whole upload. An optional one is skipped
   * and its field stays null.
   */
  boolean required() default false;
}
