package io.intellixity.tandem.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Data-access settings under {@code tandem.*}; every key can come from the environment
 * (e.g. {@code TANDEM_DEFAULT_BACKEND}, {@code TANDEM_JDBC_URL}).
 */
@ConfigurationProperties(prefix = "tandem")
public class TandemProperties {
  /** PRIMARY or SECONDARY; blank means PRIMARY. */
  private String defaultBackend = "PRIMARY";
  private final Mongo mongo = new Mongo();
  private final Jdbc jdbc = new Jdbc();
  private final Cache cache = new Cache();
  private final Batch batch = new Batch();
  private final QueryCache queryCache = new QueryCache();

  public String getDefaultBackend() { return defaultBackend; }
  public void setDefaultBackend(String defaultBackend) { this.defaultBackend = defaultBackend; }
  public Mongo getMongo() { return mongo; }
  public Jdbc getJdbc() { return jdbc; }
  public Cache getCache() { return cache; }
  public Batch getBatch() { return batch; }
  public QueryCache getQueryCache() { return queryCache; }

  public static class Mongo {
    private String uri;
    private String database = "dashboard";

    public boolean isConfigured() { return uri != null && !uri.isBlank(); }

    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
  }

  public static class Jdbc {
    private String url;
    private String username;
    private String password;
    private String schema = "public";
    private int maximumPoolSize = 10;

    public boolean isConfigured() { return url != null && !url.isBlank(); }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  }

  public static class Cache {
    private int maxSize = 500;
    private final Ttl ttl = new Ttl();
    /** Threads refreshing stale entries in the background. */
    private int revalidationThreads = 2;

    public int getMaxSize() { return maxSize; }
    public void setMaxSize(int maxSize) { this.maxSize = maxSize; }
    public Ttl getTtl() { return ttl; }
    public int getRevalidationThreads() { return revalidationThreads; }
    public void setRevalidationThreads(int revalidationThreads) { this.revalidationThreads = revalidationThreads; }
  }

  public static class Ttl {
    private Duration largeList = Duration.ofSeconds(60);
    private Duration mediumList = Duration.ofSeconds(180);
    private Duration smallList = Duration.ofSeconds(300);
    private Duration item = Duration.ofSeconds(600);
    private int largeListThreshold = 100;
    private int mediumListThreshold = 50;

    public Duration getLargeList() { return largeList; }
    public void setLargeList(Duration largeList) { this.largeList = largeList; }
    public Duration getMediumList() { return mediumList; }
    public void setMediumList(Duration mediumList) { this.mediumList = mediumList; }
    public Duration getSmallList() { return smallList; }
    public void setSmallList(Duration smallList) { this.smallList = smallList; }
    public Duration getItem() { return item; }
    public void setItem(Duration item) { this.item = item; }
    public int getLargeListThreshold() { return largeListThreshold; }
    public void setLargeListThreshold(int largeListThreshold) { this.largeListThreshold = largeListThreshold; }
    public int getMediumListThreshold() { return mediumListThreshold; }
    public void setMediumListThreshold(int mediumListThreshold) { this.mediumListThreshold = mediumListThreshold; }
  }

  public static class Batch {
    private int chunkSize = 10;

    public int getChunkSize() { return chunkSize; }
    public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }
  }

  public static class QueryCache {
    /** GraphQL endpoint; the query cache is disabled when unset. */
    private String endpoint;
    private String table = "gql_cache";
    private Duration ttl = Duration.ofMinutes(60);
    private Duration requestTimeout = Duration.ofSeconds(30);
    private final Map<String, String> headers = new HashMap<>();

    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
    public String getTable() { return table; }
    public void setTable(String table) { this.table = table; }
    public Duration getTtl() { return ttl; }
    public void setTtl(Duration ttl) { this.ttl = ttl; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    public Map<String, String> getHeaders() { return headers; }
  }
}
