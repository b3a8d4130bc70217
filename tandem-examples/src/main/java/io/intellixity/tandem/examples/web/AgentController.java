package io.intellixity.tandem.examples.web;

import io.intellixity.tandem.examples.service.AgentService;
import io.intellixity.tandem.persistence.record.DataRecord;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/agents")
public final class AgentController {
  private final AgentService agents;

  public AgentController(AgentService agents) {
    this.agents = agents;
  }

  public record CreateAgentRequest(String name, String description, String modelId, List<String> toolIds,
                                   String systemPrompt) {}

  @GetMapping
  public Map<String, List<DataRecord>> list(@RequestParam(value = "search", required = false) String search,
                                            @RequestParam(value = "modelId", required = false) String modelId) {
    return Map.of("agents", agents.list(search, modelId));
  }

  @GetMapping("/{id}")
  public ResponseEntity<DataRecord> get(@PathVariable("id") String id) {
    return agents.get(id).map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
  }

  @PostMapping
  public DataRecord create(@RequestBody CreateAgentRequest req) {
    return agents.create(req.name(), req.description(), req.modelId(), req.toolIds(), req.systemPrompt());
  }

  @PatchMapping("/{id}")
  public DataRecord update(@PathVariable("id") String id, @RequestBody Map<String, Object> partial) {
    return agents.update(id, partial);
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable("id") String id) {
    return agents.remove(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
  }
}
