package com.pld.mft.catalog.exception;

import java.sql.SQLException;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * Maps a constraint failure reported by the database to the matching {@link
 * SchemaViolationException}. Classification uses the SQLSTATE of the underlying {@link
 * SQLException}, which PostgreSQL and H2 both report in the 23xxx class.
 */
public final class SchemaViolations {

  private SchemaViolations() {}

  public static SchemaViolationException translate(
      String table, DataIntegrityViolationException ex) {
    String sqlState = findSqlState(ex);
    String message = "%s write rejected by database: %s".formatted(table, rootMessage(ex));
    if (sqlState == null) {
      return new DomainViolationException(table, message, ex);
    }
    return switch (sqlState) {
      case "23505" -> new UniquenessViolationException(table, message, ex);
      case "23503", "23506" -> new ReferentialIntegrityViolationException(table, message, ex);
      // 23502 not null, 23513/23514 check
      default -> new DomainViolationException(table, message, ex);
    };
  }

  static String findSqlState(Throwable ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SQLException && ((SQLException) current).getSQLState() != null) {
        return ((SQLException) current).getSQLState();
      }
      current = current.getCause();
    }
    return null;
  }

  private static String rootMessage(Throwable ex) {
    Throwable current = ex;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    return current.getMessage();
  }
}
