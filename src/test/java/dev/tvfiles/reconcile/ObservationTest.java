package dev.tvfiles.reconcile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class ObservationTest {

  @Test
  void ofPathSplitsCanonicalDirectoryAndName() {
    Instant created = Instant.parse("2026-01-01T00:00:00Z");

    Observation.FileInfo file = Observation.FileInfo.ofPath("/media/tv/./show//s01e01.mkv", created);

    assertThat(file.directory()).isEqualTo("/media/tv/show");
    assertThat(file.name()).isEqualTo("s01e01.mkv");
    assertThat(file.createdAt()).isEqualTo(created);
  }

  @Test
  void fileAtRootHasRootDirectory() {
    Observation.FileInfo file = Observation.FileInfo.ofPath("/a.mkv", null);

    assertThat(file.directory()).isEqualTo("/");
    assertThat(file.name()).isEqualTo("a.mkv");
  }

  @Test
  void rootPathHasNoFileName() {
    assertThatThrownBy(() -> Observation.FileInfo.ofPath("/", null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void bareFileObservationHasNoCatalogContext() {
    Observation observation = Observation.ofFile(new Observation.FileInfo("/media", "a.mkv", null));

    assertThat(observation.series()).isNull();
    assertThat(observation.episode()).isNull();
  }

  @Test
  void fileIsMandatory() {
    assertThatThrownBy(() -> new Observation(null, null, null))
        .isInstanceOf(NullPointerException.class);
  }
}
