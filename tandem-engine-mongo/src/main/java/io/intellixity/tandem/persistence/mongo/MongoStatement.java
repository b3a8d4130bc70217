package io.intellixity.tandem.persistence.mongo;

import io.intellixity.tandem.persistence.spi.sql.NativeStatement;
import org.bson.Document;

import java.util.List;

/** Backend-native statement representation for MongoDB. */
public record MongoStatement(
    Kind kind,
    String collection,
    Document filter,
    List<Document> pipeline,
    Document sort,
    Document projection,
    Integer skip,
    Integer limit
) implements NativeStatement {
  public enum Kind {
    FIND,
    COUNT,
    /** Used when relation hints need $lookup stages. */
    AGGREGATE
  }

  public MongoStatement {
    filter = (filter == null) ? new Document() : filter;
    pipeline = (pipeline == null) ? List.of() : List.copyOf(pipeline);
  }
}
