package io.intellixity.tandem.persistence.access.cache;

import java.time.Duration;
import java.util.Objects;

/** Chooses cache TTLs by result shape: bigger lists go stale sooner, single records live longest. */
public record TtlPolicy(Duration largeList, Duration mediumList, Duration smallList, Duration item,
                        int largeListThreshold, int mediumListThreshold) {
  public TtlPolicy {
    Objects.requireNonNull(largeList, "largeList");
    Objects.requireNonNull(mediumList, "mediumList");
    Objects.requireNonNull(smallList, "smallList");
    Objects.requireNonNull(item, "item");
    if (mediumListThreshold > largeListThreshold) {
      throw new IllegalArgumentException("mediumListThreshold must be <= largeListThreshold");
    }
  }

  public static TtlPolicy defaults() {
    return new TtlPolicy(Duration.ofSeconds(60), Duration.ofSeconds(180), Duration.ofSeconds(300),
        Duration.ofSeconds(600), 100, 50);
  }

  public Duration forList(int size) {
    if (size > largeListThreshold) return largeList;
    if (size > mediumListThreshold) return mediumList;
    return smallList;
  }

  public Duration forItem() {
    return item;
  }
}
