package io.intellixity.tandem.examples.web;

import io.intellixity.tandem.examples.service.ModelService;
import io.intellixity.tandem.persistence.query.PageResult;
import io.intellixity.tandem.persistence.record.DataRecord;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/models")
public final class ModelController {
  private final ModelService models;

  public ModelController(ModelService models) {
    this.models = models;
  }

  @GetMapping
  public PageResult page(@RequestParam(value = "provider", required = false) String provider,
                         @RequestParam(value = "page", defaultValue = "1") int page,
                         @RequestParam(value = "pageSize", defaultValue = "20") int pageSize) {
    return models.page(provider, page, pageSize);
  }

  @GetMapping("/{id}")
  public ResponseEntity<DataRecord> get(@PathVariable("id") String id) {
    return models.get(id).map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
  }
}
