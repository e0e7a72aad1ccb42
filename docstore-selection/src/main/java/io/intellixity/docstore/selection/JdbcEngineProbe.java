package io.intellixity.docstore.selection;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.docstore.exceptions.BackendUnavailableException;
import io.intellixity.docstore.exec.DocumentEngine;
import io.intellixity.docstore.jdbc.JdbcDocumentEngine;
import io.intellixity.docstore.jdbc.JdbcHandle;
import io.intellixity.docstore.jdbc.dialect.AnsiSqlDialect;
import io.intellixity.docstore.jdbc.dialect.JdbcDialect;
import io.intellixity.docstore.jdbc.postgres.PostgresDialect;
import io.intellixity.docstore.selection.StoreSettings.RelationalSettings;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.function.Function;

/**
 * Relational probe: builds a HikariCP pool for the configured URL and validates one connection.
 * Pool creation failing counts as the backend being unavailable.
 */
public final class JdbcEngineProbe implements EngineProbe {
  private final RelationalSettings settings;
  private final Function<HikariConfig, DataSource> poolFactory;

  public JdbcEngineProbe(RelationalSettings settings) {
    this(settings, HikariDataSource::new);
  }

  /** Pool factory is replaceable so probing can run without a database. */
  public JdbcEngineProbe(RelationalSettings settings, Function<HikariConfig, DataSource> poolFactory) {
    this.settings = settings;
    this.poolFactory = poolFactory;
  }

  @Override public String family() { return JdbcDocumentEngine.FAMILY; }

  @Override public boolean configured() { return settings != null; }

  @Override
  public DocumentEngine connect() {
    DataSource ds;
    try {
      ds = poolFactory.apply(poolConfig());
    } catch (RuntimeException e) {
      throw new BackendUnavailableException(family(), "could not create connection pool for " + settings.url(), e);
    }
    try (Connection c = ds.getConnection()) {
      int timeoutSeconds = (int) Math.max(1, settings.connectionTimeoutMs() / 1000);
      if (!c.isValid(timeoutSeconds)) {
        throw new SQLException("connection failed validation");
      }
    } catch (SQLException | RuntimeException e) {
      closeQuietly(ds, e);
      throw new BackendUnavailableException(family(), "could not connect to " + settings.url(), e);
    }
    return new JdbcDocumentEngine(new JdbcHandle("jdbc:" + settings.url(), ds, settings.schema()), dialectFor(settings.url()));
  }

  HikariConfig poolConfig() {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(settings.url());
    hc.setUsername(settings.username());
    hc.setPassword(settings.password());
    hc.setMaximumPoolSize(settings.maxPoolSize());
    hc.setConnectionTimeout(settings.connectionTimeoutMs());
    hc.setPoolName("docstore-jdbc");
    return hc;
  }

  static JdbcDialect dialectFor(String url) {
    return url.startsWith("jdbc:postgresql:") ? new PostgresDialect() : new AnsiSqlDialect();
  }

  private static void closeQuietly(DataSource ds, Exception primary) {
    if (ds instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        primary.addSuppressed(e);
      }
    }
  }
}
