package io.intellixity.docstore.selection;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.intellixity.docstore.exceptions.BackendUnavailableException;
import io.intellixity.docstore.exec.DocumentEngine;
import io.intellixity.docstore.mongo.MongoDocumentEngine;
import io.intellixity.docstore.mongo.MongoHandle;
import io.intellixity.docstore.selection.StoreSettings.MongoSettings;
import org.bson.Document;

import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/** Document-store probe: creates a client with a bounded server-selection timeout and issues {@code ping}. */
public final class MongoEngineProbe implements EngineProbe {
  private final MongoSettings settings;
  private final Function<MongoClientSettings, MongoClient> clientFactory;

  public MongoEngineProbe(MongoSettings settings) {
    this(settings, MongoClients::create);
  }

  public MongoEngineProbe(MongoSettings settings, Function<MongoClientSettings, MongoClient> clientFactory) {
    this.settings = settings;
    this.clientFactory = clientFactory;
  }

  @Override public String family() { return MongoDocumentEngine.FAMILY; }

  @Override public boolean configured() { return settings != null; }

  @Override
  public DocumentEngine connect() {
    MongoClient client;
    try {
      client = clientFactory.apply(clientSettings());
    } catch (RuntimeException e) {
      throw new BackendUnavailableException(family(), "could not create client for database " + settings.database(), e);
    }
    try {
      client.getDatabase(settings.database()).runCommand(new Document("ping", 1));
    } catch (RuntimeException e) {
      try {
        client.close();
      } catch (RuntimeException ce) {
        e.addSuppressed(ce);
      }
      throw new BackendUnavailableException(family(), "ping failed for database " + settings.database(), e);
    }
    return new MongoDocumentEngine(new MongoHandle("mongo:" + settings.database(), client, settings.database()));
  }

  MongoClientSettings clientSettings() {
    return MongoClientSettings.builder()
        .applyConnectionString(new ConnectionString(settings.uri()))
        .applyToClusterSettings(b -> b.serverSelectionTimeout(settings.serverSelectionTimeoutMs(), TimeUnit.MILLISECONDS))
        .build();
  }
}
