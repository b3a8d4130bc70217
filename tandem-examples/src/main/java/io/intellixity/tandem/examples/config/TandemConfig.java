package io.intellixity.tandem.examples.config;

import io.intellixity.tandem.persistence.access.Backends;
import io.intellixity.tandem.persistence.access.DataAccess;
import io.intellixity.tandem.persistence.access.cache.CacheStore;
import io.intellixity.tandem.persistence.access.cache.TtlPolicy;
import io.intellixity.tandem.persistence.exec.BackendKind;
import io.intellixity.tandem.querycache.GraphQlHttpOrigin;
import io.intellixity.tandem.querycache.QueryResultCache;
import io.intellixity.tandem.querycache.SemanticStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(TandemProperties.class)
public class TandemConfig {

  @Bean
  public BackendConnections backendConnections(TandemProperties props) {
    return BackendConnections.open(props);
  }

  @Bean
  public Backends backends(BackendConnections connections, TandemProperties props) {
    // Fails startup on a bad or unusable default backend.
    return connections.backends(props.getDefaultBackend());
  }

  @Bean
  public CacheStore cacheStore(TandemProperties props) {
    return new CacheStore(props.getCache().getMaxSize(), CacheStore.DEFAULT_TTL);
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService revalidationExecutor(TandemProperties props) {
    AtomicInteger n = new AtomicInteger();
    ThreadFactory daemons = r -> {
      Thread t = new Thread(r, "tandem-revalidate-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
    int threads = Math.max(1, props.getCache().getRevalidationThreads());
    // Rejections surface to the facade, which logs them and keeps serving the stale entry.
    return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(256), daemons, new ThreadPoolExecutor.AbortPolicy());
  }

  @Bean
  public DataAccess dataAccess(Backends backends, CacheStore cache, ExecutorService revalidationExecutor,
                               TandemProperties props) {
    return DataAccess.builder(backends)
        .cache(cache)
        .ttlPolicy(ttlPolicy(props))
        .chunkSize(props.getBatch().getChunkSize())
        .revalidationExecutor(revalidationExecutor)
        .build();
  }

  static TtlPolicy ttlPolicy(TandemProperties props) {
    TandemProperties.Ttl t = props.getCache().getTtl();
    return new TtlPolicy(t.getLargeList(), t.getMediumList(), t.getSmallList(), t.getItem(),
        t.getLargeListThreshold(), t.getMediumListThreshold());
  }

  @Bean
  @ConditionalOnMissingBean
  public SemanticStore semanticStore() {
    return SemanticStore.none();
  }

  @Bean
  @ConditionalOnProperty(prefix = "tandem.query-cache", name = "endpoint")
  public QueryResultCache queryResultCache(Backends backends, SemanticStore semanticStore, TandemProperties props) {
    TandemProperties.QueryCache q = props.getQueryCache();
    GraphQlHttpOrigin origin = new GraphQlHttpOrigin(HttpClient.newHttpClient(), URI.create(q.getEndpoint()),
        q.getHeaders(), q.getRequestTimeout());
    // Rows live in the relational store; a missing SECONDARY fails startup here.
    return new QueryResultCache(backends.client(BackendKind.SECONDARY), origin, semanticStore,
        q.getTable(), q.getTtl(), null);
  }
}
