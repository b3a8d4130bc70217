package io.intellixity.tandem.persistence.access;

import io.intellixity.tandem.persistence.error.NotConfiguredException;
import io.intellixity.tandem.persistence.exec.BackendClient;
import io.intellixity.tandem.persistence.exec.BackendKind;
import io.intellixity.tandem.persistence.exec.TransactionalBackendClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * The process's backend slots, resolved once at startup.\n
 *
 * Resolution fails loudly: no configured backend, a client in the wrong slot, or a default backend
 * without a client all throw {@link NotConfiguredException} before any request is served.\n
 */
public final class Backends {
  private static final Logger log = LoggerFactory.getLogger(Backends.class);

  private final BackendClient primary;
  private final BackendClient secondary;
  private final BackendKind defaultKind;

  private Backends(BackendClient primary, BackendClient secondary, BackendKind defaultKind) {
    this.primary = primary;
    this.secondary = secondary;
    this.defaultKind = defaultKind;
  }

  /**
   * @param primary document-store client or null
   * @param secondary relational client or null
   * @param defaultSetting PRIMARY or SECONDARY (any case); blank means PRIMARY
   */
  public static Backends resolve(BackendClient primary, BackendClient secondary, String defaultSetting) {
    BackendKind kind;
    try {
      kind = BackendKind.parse(defaultSetting);
    } catch (IllegalArgumentException e) {
      NotConfiguredException nce = new NotConfiguredException(null, "startup", e.getMessage());
      nce.addSuppressed(e);
      throw nce;
    }
    return resolve(primary, secondary, kind == null ? BackendKind.PRIMARY : kind);
  }

  public static Backends resolve(BackendClient primary, BackendClient secondary, BackendKind defaultKind) {
    if (primary == null && secondary == null) {
      throw new NotConfiguredException(null, "startup", "No backend configured: configure a PRIMARY and/or SECONDARY client");
    }
    requireSlot(primary, BackendKind.PRIMARY);
    requireSlot(secondary, BackendKind.SECONDARY);
    BackendKind def = (defaultKind == null) ? BackendKind.PRIMARY : defaultKind;
    if ((def == BackendKind.PRIMARY ? primary : secondary) == null) {
      throw new NotConfiguredException(def, "startup", "Default backend " + def + " has no configured client");
    }
    log.info("tandem.backends default={} primary={} secondary={}", def,
        primary == null ? "none" : primary.handle().id(),
        secondary == null ? "none" : secondary.handle().id());
    return new Backends(primary, secondary, def);
  }

  private static void requireSlot(BackendClient client, BackendKind slot) {
    if (client != null && client.kind() != slot) {
      throw new NotConfiguredException(slot, "startup",
          "Client '" + client.handle().id() + "' declares " + client.kind() + " but was configured as " + slot);
    }
  }

  public BackendKind defaultKind() {
    return defaultKind;
  }

  public boolean isConfigured(BackendKind kind) {
    return find(kind).isPresent();
  }

  public Optional<BackendClient> find(BackendKind kind) {
    return Optional.ofNullable(kind == BackendKind.PRIMARY ? primary : secondary);
  }

  /** @throws NotConfiguredException when the slot is empty */
  public BackendClient client(BackendKind kind) {
    return find(kind).orElseThrow(() -> new NotConfiguredException(kind, "resolve", "Backend " + kind + " is not configured"));
  }

  /** The transactional (SECONDARY) client, if the secondary slot holds one. */
  public Optional<TransactionalBackendClient> transactional() {
    return (secondary instanceof TransactionalBackendClient t) ? Optional.of(t) : Optional.empty();
  }
}
