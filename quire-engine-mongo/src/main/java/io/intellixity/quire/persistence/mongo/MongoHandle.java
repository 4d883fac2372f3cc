package io.intellixity.quire.persistence.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;

import java.util.Objects;

/** Mongo client plus the database the store reads from (resolved by application code). */
public final class MongoHandle {
  private final String id;
  private final MongoClient client;
  private final String database;

  public MongoHandle(String id, MongoClient client, String database) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.database = Objects.requireNonNull(database, "database");
  }

  public String id() { return id; }
  public MongoClient client() { return client; }
  public String databaseName() { return database; }

  public MongoDatabase database() {
    return client.getDatabase(database);
  }
}
