package io.intellixity.docstore.mongo;

import com.mongodb.client.MongoClient;
import io.intellixity.docstore.exec.handle.EngineHandle;

import java.util.Objects;

/** Mongo engine handle. */
public final class MongoHandle implements EngineHandle<MongoClient> {
  private final String id;
  private final MongoClient client;
  private final String database;

  public MongoHandle(String id, MongoClient client, String database) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.database = Objects.requireNonNull(database, "database");
  }

  @Override public String id() { return id; }
  @Override public MongoClient client() { return client; }
  @Override public String namespace() { return database; }

  public String database() { return database; }
}
