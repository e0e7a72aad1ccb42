package io.intellixity.docstore.spring;

import io.intellixity.docstore.selection.StoreSettings;
import io.intellixity.docstore.selection.StoreSettings.MongoSettings;
import io.intellixity.docstore.selection.StoreSettings.RelationalSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "docstore")
public class DocStoreProperties {
  private final Relational relational = new Relational();
  private final Mongo mongo = new Mongo();

  /** When true, descriptors absent here are read from DATABASE_URL / MONGO_URI style environment variables. */
  private boolean useEnvironment = true;

  public Relational getRelational() { return relational; }
  public Mongo getMongo() { return mongo; }
  public boolean isUseEnvironment() { return useEnvironment; }
  public void setUseEnvironment(boolean useEnvironment) { this.useEnvironment = useEnvironment; }

  /** Settings from these properties, with the environment filling descriptors left unset. */
  public StoreSettings toSettings(StoreSettings environment) {
    StoreSettings env = (useEnvironment && environment != null) ? environment : StoreSettings.none();
    RelationalSettings r = relational.toSettings();
    MongoSettings m = mongo.toSettings();
    return new StoreSettings(r != null ? r : env.relational(), m != null ? m : env.mongo());
  }

  public static class Relational {
    /** {@code jdbc:} URL, or a {@code postgres://} URL. */
    private String url;
    private String username;
    private String password;
    private String schema;
    private int maxPoolSize = RelationalSettings.DEFAULT_MAX_POOL_SIZE;
    private long connectionTimeoutMs = RelationalSettings.DEFAULT_CONNECTION_TIMEOUT_MS;

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
    public long getConnectionTimeoutMs() { return connectionTimeoutMs; }
    public void setConnectionTimeoutMs(long connectionTimeoutMs) { this.connectionTimeoutMs = connectionTimeoutMs; }

    RelationalSettings toSettings() {
      if (url == null || url.isBlank()) return null;
      RelationalSettings parsed = RelationalSettings.fromUrlOrNull(url.trim(), username, password, "docstore.relational.url");
      if (parsed == null) return null;
      return new RelationalSettings(parsed.url(), parsed.username(), parsed.password(), schema,
          maxPoolSize, connectionTimeoutMs);
    }
  }

  public static class Mongo {
    private String uri;
    private String database = StoreSettings.DEFAULT_MONGO_DATABASE;
    private long serverSelectionTimeoutMs = MongoSettings.DEFAULT_SERVER_SELECTION_TIMEOUT_MS;

    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
    public long getServerSelectionTimeoutMs() { return serverSelectionTimeoutMs; }
    public void setServerSelectionTimeoutMs(long serverSelectionTimeoutMs) { this.serverSelectionTimeoutMs = serverSelectionTimeoutMs; }

    MongoSettings toSettings() {
      if (uri == null || uri.isBlank()) return null;
      return new MongoSettings(uri.trim(), database, serverSelectionTimeoutMs);
    }
  }
}
