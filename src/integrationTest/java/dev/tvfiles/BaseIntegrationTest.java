package dev.tvfiles;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared base class for all integration tests.
 *
 * <p>Provides a Testcontainers-managed PostgreSQL instance migrated by Flyway and empties every
 * table before each test. The command-line runner sees no arguments and does nothing.
 */
@SpringBootTest
public abstract class BaseIntegrationTest {

  @ServiceConnection
  static PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

  static {
    postgres.start();
  }

  @Autowired protected JdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanDatabase() {
    jdbcTemplate.execute(
        "TRUNCATE files, scan_dirs, plex_files, plex_episodes, plex_series,"
            + " sonarr_files, sonarr_episodes, sonarr_series, sync_runs");
  }
}
