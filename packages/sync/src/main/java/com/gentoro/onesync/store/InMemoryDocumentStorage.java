package com.gentoro.onesync.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.onesync.exception.SerializationException;
import com.gentoro.onesync.model.Database;
import com.gentoro.onesync.utility.JacksonUtility;
import java.util.Optional;

/**
 * Keeps the serialized document in memory. Every read deserializes a fresh copy, so callers see
 * the same isolation they get from the file variant.
 */
public class InMemoryDocumentStorage implements DocumentStorage {
  private volatile String json;

  @Override
  public void open() {}

  @Override
  public Optional<Database> read() {
    String snapshot = json;
    if (snapshot == null) return Optional.empty();
    try {
      return Optional.of(JacksonUtility.getJsonMapper().readValue(snapshot, Database.class));
    } catch (JsonProcessingException e) {
      throw new SerializationException("Malformed in-memory database", e);
    }
  }

  @Override
  public void write(Database database) {
    json = JacksonUtility.toJson(database);
  }

  @Override
  public void close() {}

  @Override
  public String describe() {
    return "in-memory";
  }
}
