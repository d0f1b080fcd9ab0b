package io.intellixity.docmap.mongo;

import com.mongodb.client.MongoClient;

import java.util.Objects;

/** Mongo client plus the database documents live in (resolved by application code). */
public record MongoHandle(String id, MongoClient client, String database) {
  public MongoHandle {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(client, "client");
    Objects.requireNonNull(database, "database");
    if (database.isBlank()) throw new IllegalArgumentException("database is required");
  }

  public static MongoHandle of(MongoClient client, String database) {
    return new MongoHandle("mongo", client, database);
  }
}
