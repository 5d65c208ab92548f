package dev.tvfiles.sonarr;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link SonarrEpisode} entities. */
public interface SonarrEpisodeRepository extends JpaRepository<SonarrEpisode, UUID> {

  Optional<SonarrEpisode> findBySonarrId(int sonarrId);

  boolean existsBySonarrId(int sonarrId);
}
