package autopilot.spi;

import autopilot.config.AutonomousConfig;

import java.sql.Connection;
import java.util.Optional;

/**
 * Versioned scheduler configuration: every update appends a row and the highest
 * version wins.
 */
public interface ConfigStore {

  Optional<AutonomousConfig> loadLatest(Connection conn);

  /**
   * Appends {@code config} as a new version.
   *
   * @throws autopilot.StoreException if the version already exists
   */
  void append(Connection conn, AutonomousConfig config);
}
