package io.intellixity.docstore.jdbc.dialect;

/**
 * SQL:2008 dialect for JDBC sources without a dedicated dialect: identity columns, {@code OFFSET/FETCH} paging and
 * generated-key retrieval through the driver.
 */
public final class AnsiSqlDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "ansi"; }
}
