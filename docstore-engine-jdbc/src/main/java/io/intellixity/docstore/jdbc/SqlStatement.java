package io.intellixity.docstore.jdbc;

import java.util.List;

public record SqlStatement(String sql, List<Bind> binds, ExecKind execKind) {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery() (used for SELECT/COUNT). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate() (DDL, DML without returned keys). */
    UPDATE,
    /** Execute via PreparedStatement.executeUpdate() + getGeneratedKeys(). */
    UPDATE_GENERATED_KEYS,
    /** Execute via PreparedStatement.executeQuery() and read the first column of the first row (RETURNING). */
    QUERY_ONE_VALUE
  }

  public SqlStatement {
    binds = binds == null ? List.of() : List.copyOf(binds);
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Bind> binds) {
    this(sql, binds, ExecKind.QUERY);
  }
}
