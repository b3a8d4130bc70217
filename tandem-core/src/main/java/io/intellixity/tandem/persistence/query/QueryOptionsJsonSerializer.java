package io.intellixity.tandem.persistence.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Canonical JSON serializer for {@link QueryOptions}.\n
 *
 * Field order is fixed and empty parts are omitted, so equal options always produce equal text
 * (used for cache keys).\n
 */
public final class QueryOptionsJsonSerializer extends JsonSerializer<QueryOptions> {
  @Override
  public void serialize(QueryOptions q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();

    if (!q.filters().isEmpty()) {
      g.writeArrayFieldStart("filters");
      for (FilterCondition c : q.filters()) {
        g.writeStartObject();
        g.writeStringField("column", c.column());
        g.writeStringField("operator", c.operator().wireName());
        g.writeFieldName("value");
        serializers.defaultSerializeValue(c.value(), g);
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    Page p = q.page();
    if (p instanceof OffsetPage op) {
      g.writeObjectFieldStart("page");
      g.writeStringField("type", "offset");
      g.writeNumberField("offset", op.offset());
      g.writeNumberField("limit", op.limit());
      g.writeEndObject();
    } else if (p instanceof CursorPage cp) {
      g.writeObjectFieldStart("page");
      g.writeStringField("type", "cursor");
      g.writeFieldName("cursor");
      serializers.defaultSerializeValue(cp.cursor(), g);
      g.writeNumberField("limit", cp.limit());
      g.writeEndObject();
    }

    if (!q.sort().isEmpty()) {
      g.writeArrayFieldStart("sort");
      for (SortField sf : q.sort()) {
        g.writeStartObject();
        g.writeStringField("column", sf.column());
        g.writeStringField("dir", sf.ascending() ? "ASC" : "DESC");
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (!q.select().isEmpty()) {
      g.writeArrayFieldStart("select");
      for (String s : q.select()) g.writeString(s);
      g.writeEndArray();
    }

    if (!q.include().isEmpty()) {
      g.writeArrayFieldStart("include");
      for (Include inc : q.include()) {
        g.writeStartObject();
        g.writeStringField("table", inc.table());
        g.writeStringField("foreignKey", inc.foreignKey());
        g.writeStringField("primaryKey", inc.primaryKey());
        if (!inc.fields().isEmpty()) {
          g.writeArrayFieldStart("fields");
          for (String f : inc.fields()) g.writeString(f);
          g.writeEndArray();
        }
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.count()) g.writeBooleanField("count", true);
    if (q.unsupportedOperators() != UnsupportedOperatorPolicy.ABORT) {
      g.writeStringField("unsupportedOperators", q.unsupportedOperators().name());
    }

    g.writeEndObject();
  }
}
