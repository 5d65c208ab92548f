package dev.tvfiles.reconcile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PathCanonicalizerTest {

  @ParameterizedTest
  @ValueSource(
      strings = {"/media/tv/show", "/media/tv/show/", "/media//tv/show", "/media/./tv/show",
        "/media/tv/other/../show"})
  void equivalentSpellingsCanonicalizeToTheSameString(String path) {
    assertThat(PathCanonicalizer.canonicalize(path)).isEqualTo("/media/tv/show");
  }

  @Test
  void relativePathIsResolvedAgainstWorkingDirectory() {
    String expected = Path.of("").toAbsolutePath().resolve("show").toString();

    assertThat(PathCanonicalizer.canonicalize("show")).isEqualTo(expected);
  }

  @Test
  void blankPathIsRejected() {
    assertThatThrownBy(() -> PathCanonicalizer.canonicalize("  "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void nulCharacterIsRejected() {
    assertThatThrownBy(() -> PathCanonicalizer.canonicalize("/media/\0tv"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Invalid path");
  }
}
