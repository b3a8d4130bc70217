package io.intellixity.tandem.examples.service;

import io.intellixity.tandem.persistence.access.DataAccess;
import io.intellixity.tandem.persistence.access.DataAccessFacade;
import io.intellixity.tandem.persistence.query.OffsetPage;
import io.intellixity.tandem.persistence.query.PageResult;
import io.intellixity.tandem.persistence.query.QueryFilters;
import io.intellixity.tandem.persistence.query.QueryOptions;
import io.intellixity.tandem.persistence.record.DataRecord;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public final class ModelService {
  private final DataAccessFacade models;

  public ModelService(DataAccess access) {
    this.models = access.collection("models");
  }

  public PageResult page(String provider, int page, int pageSize) {
    QueryOptions q = new QueryOptions()
        .orderBy("name", true)
        .withPage(OffsetPage.of(page, pageSize))
        .withCount(true);
    if (provider != null && !provider.isBlank()) q.withFilter(QueryFilters.eq("provider", provider));
    return models.getPage(q);
  }

  public Optional<DataRecord> get(String id) {
    return models.getById(id);
  }

  public long countByProvider(String provider) {
    return models.count(new QueryOptions().withFilter(QueryFilters.eq("provider", provider)));
  }
}
