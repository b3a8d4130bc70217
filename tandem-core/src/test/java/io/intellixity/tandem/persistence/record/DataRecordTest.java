package io.intellixity.tandem.persistence.record;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DataRecordTest {

  @Test
  void mergeIgnoresIdAndKeepsOtherFields() {
    DataRecord r = DataRecord.of(Map.of("id", "a1", "name", "agent"));
    DataRecord merged = r.merge(Map.of("id", "other", "status", "on"));
    assertEquals("a1", merged.id());
    assertEquals("agent", merged.get("name"));
    assertEquals("on", merged.get("status"));
    assertNull(r.get("status"));
  }

  @Test
  void withIdPutsIdFirst() {
    DataRecord r = DataRecord.of(Map.of("name", "x")).withId(7);
    assertEquals("id", r.fields().keySet().iterator().next());
    assertEquals(7, r.id());
  }

  @Test
  void jsonIsThePlainFieldMap() throws Exception {
    ObjectMapper json = new ObjectMapper();
    DataRecord r = DataRecord.of(Map.of("id", "t1")).with("count", 3);
    String s = json.writeValueAsString(r);
    assertEquals("{\"id\":\"t1\",\"count\":3}", s);
    assertEquals(r, json.readValue(s, DataRecord.class));
  }
}
