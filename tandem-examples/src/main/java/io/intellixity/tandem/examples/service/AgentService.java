package io.intellixity.tandem.examples.service;

import io.intellixity.tandem.persistence.access.DataAccess;
import io.intellixity.tandem.persistence.access.DataAccessFacade;
import io.intellixity.tandem.persistence.error.ValidationException;
import io.intellixity.tandem.persistence.query.QueryFilters;
import io.intellixity.tandem.persistence.query.QueryOptions;
import io.intellixity.tandem.persistence.record.DataRecord;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public final class AgentService {
  private final DataAccessFacade agents;
  private final DataAccessFacade models;
  private final DataAccessFacade tools;

  public AgentService(DataAccess access) {
    this.agents = access.collection("agents");
    this.models = access.collection("models");
    this.tools = access.collection("tools");
  }

  /** Newest first; {@code search} matches the name case-insensitively. */
  public List<DataRecord> list(String search, String modelId) {
    QueryOptions q = new QueryOptions().orderBy("created_at", false);
    if (search != null && !search.isBlank()) q.withFilter(QueryFilters.ilike("name", "%" + search.trim() + "%"));
    if (modelId != null && !modelId.isBlank()) q.withFilter(QueryFilters.eq("model_id", modelId));
    List<DataRecord> out = new ArrayList<>();
    for (DataRecord a : agents.getAll(q)) out.add(describe(a));
    return out;
  }

  public Optional<DataRecord> get(String id) {
    return agents.getById(id).map(this::describe);
  }

  public DataRecord create(String name, String description, String modelId, List<String> toolIds, String systemPrompt) {
    if (isBlank(name) || isBlank(description) || isBlank(modelId)) {
      throw new ValidationException("createAgent", "name, description and modelId are required");
    }
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("name", name);
    data.put("description", description);
    data.put("model_id", modelId);
    data.put("tool_ids", toolIds == null ? List.of() : List.copyOf(toolIds));
    data.put("system_prompt", systemPrompt);
    return describe(agents.create(data));
  }

  public DataRecord update(String id, Map<String, Object> partial) {
    return describe(agents.update(id, partial));
  }

  public boolean remove(String id) {
    return agents.remove(id);
  }

  /** Adds the model name and the names of the tools that still exist. */
  private DataRecord describe(DataRecord agent) {
    Object modelId = agent.get("model_id");
    String model = (modelId == null) ? null : models.getById(modelId).map(m -> m.getString("name")).orElse(null);

    List<String> toolNames = new ArrayList<>();
    if (agent.get("tool_ids") instanceof List<?> ids) {
      for (Object toolId : ids) {
        if (toolId == null) continue;
        tools.getById(toolId).map(t -> t.getString("name")).ifPresent(toolNames::add);
      }
    }
    return agent.with("model", model == null ? "Unknown Model" : model).with("tools", toolNames);
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
