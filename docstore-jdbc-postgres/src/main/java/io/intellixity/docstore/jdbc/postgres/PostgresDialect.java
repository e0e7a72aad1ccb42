package io.intellixity.docstore.jdbc.postgres;

import io.intellixity.docstore.jdbc.Bind;
import io.intellixity.docstore.jdbc.SqlStatement.ExecKind;
import io.intellixity.docstore.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.docstore.jdbc.schema.ColumnType;
import io.intellixity.docstore.query.Page;
import io.intellixity.docstore.query.SortField;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;

/**
 * Postgres dialect implementation for JDBC.
 * <p>
 * Keeps only Postgres-specific overrides: {@code BIGSERIAL} identities, {@code JSONB} structures,
 * {@code RETURNING} ids, {@code LIMIT/OFFSET} paging and null ordering matching the in-memory engine
 * (nulls lowest). Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String sqlType(ColumnType type) {
    return (type == ColumnType.JSON) ? "JSONB" : super.sqlType(type);
  }

  @Override
  protected String identityColumnType() {
    return "BIGSERIAL";
  }

  @Override
  protected int nullSqlType(ColumnType type) {
    return (type == ColumnType.JSON) ? Types.OTHER : super.nullSqlType(type);
  }

  @Override
  protected void bindJson(PreparedStatement ps, int position, String json) throws SQLException {
    PGobject obj = new PGobject();
    obj.setType("jsonb");
    obj.setValue(json);
    ps.setObject(position, obj);
  }

  @Override
  protected String renderOrderTerm(String column, SortField.Direction direction) {
    return column + (direction == SortField.Direction.DESC ? " DESC NULLS LAST" : " ASC NULLS FIRST");
  }

  /** GREATEST ignores NULL, so a missing timestamp is replaced and a later one is kept. */
  @Override
  protected String renderTouch(String column, Instant now, RenderCtx ctx) {
    return "GREATEST(" + column + ", " + ctx.add(new Bind(now, ColumnType.TIMESTAMP)) + ")";
  }

  @Override
  protected String applyOffsetPage(String sql, Page page) {
    StringBuilder out = new StringBuilder(sql);
    if (!page.unlimited()) out.append(" LIMIT ").append(page.limit());
    if (page.skip() > 0) out.append(" OFFSET ").append(page.skip());
    return out.toString();
  }

  @Override
  protected ExecKind insertExecKind() {
    return ExecKind.QUERY_ONE_VALUE;
  }

  @Override
  protected String applyInsertReturning(String insertSql, String idColumn) {
    return insertSql + " RETURNING " + quoteIdent(idColumn);
  }
}
