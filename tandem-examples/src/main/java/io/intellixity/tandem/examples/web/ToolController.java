package io.intellixity.tandem.examples.web;

import io.intellixity.tandem.examples.service.ToolService;
import io.intellixity.tandem.persistence.access.BatchItemResult;
import io.intellixity.tandem.persistence.record.DataRecord;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tools")
public final class ToolController {
  private final ToolService tools;

  public ToolController(ToolService tools) {
    this.tools = tools;
  }

  @GetMapping
  public List<DataRecord> list(@RequestParam(value = "category", required = false) String category) {
    return tools.list(category);
  }

  @GetMapping("/{id}")
  public ResponseEntity<DataRecord> get(@PathVariable("id") String id) {
    return tools.get(id).map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
  }

  @PostMapping
  public DataRecord create(@RequestBody Map<String, Object> data) {
    return tools.create(data);
  }

  /** One entry per input item, in input order: the stored record or the error message. */
  @PostMapping("/batch")
  public List<Map<String, Object>> register(@RequestBody List<Map<String, Object>> items) {
    return tools.register(items).stream().map(ToolController::view).toList();
  }

  @PostMapping("/retire")
  public Map<String, Boolean> retire(@RequestBody List<String> ids) {
    return Map.of("success", tools.retire(ids));
  }

  private static Map<String, Object> view(BatchItemResult r) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("index", r.index());
    m.put("success", r.isSuccess());
    if (r.isSuccess()) m.put("record", r.record());
    else m.put("error", r.error().getMessage());
    return m;
  }
}
