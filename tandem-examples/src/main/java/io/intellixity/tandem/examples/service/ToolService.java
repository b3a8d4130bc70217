package io.intellixity.tandem.examples.service;

import io.intellixity.tandem.persistence.access.BatchItemResult;
import io.intellixity.tandem.persistence.access.DataAccess;
import io.intellixity.tandem.persistence.access.DataAccessFacade;
import io.intellixity.tandem.persistence.query.QueryFilters;
import io.intellixity.tandem.persistence.query.QueryOptions;
import io.intellixity.tandem.persistence.record.DataRecord;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public final class ToolService {
  private final DataAccessFacade tools;

  public ToolService(DataAccess access) {
    this.tools = access.collection("tools");
  }

  public List<DataRecord> list(String category) {
    QueryOptions q = new QueryOptions().orderBy("name", true);
    if (category != null && !category.isBlank()) q.withFilter(QueryFilters.eq("category", category));
    return tools.getAll(q);
  }

  public Optional<DataRecord> get(String id) {
    return tools.getById(id);
  }

  public DataRecord create(Map<String, Object> data) {
    return tools.create(data);
  }

  /** Registers many tools; each entry reports its own outcome. */
  public List<BatchItemResult> register(List<Map<String, Object>> items) {
    return tools.batchCreate(items);
  }

  public boolean retire(List<String> ids) {
    return tools.batchRemove(ids);
  }
}
