package io.intellixity.tandem.persistence.access;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Observer for fallbacks (metrics, alerting). Must not throw. */
@FunctionalInterface
public interface FallbackListener {
  void onFallback(FallbackEvent event);

  /** Default listener: one WARN line per fallback. */
  static FallbackListener logging() {
    return LoggingFallbackListener.INSTANCE;
  }

  final class LoggingFallbackListener implements FallbackListener {
    private static final Logger log = LoggerFactory.getLogger(FallbackListener.class);
    static final LoggingFallbackListener INSTANCE = new LoggingFallbackListener();

    private LoggingFallbackListener() {}

    @Override
    public void onFallback(FallbackEvent e) {
      log.warn("tandem.fallback op={} from={} to={} error={} message={}",
          e.operation(), e.fromBackend(), e.toBackend(), e.errorClass(), e.errorMessage());
    }
  }
}
