package dev.tvfiles.plex;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link PlexEpisode} entities. */
public interface PlexEpisodeRepository extends JpaRepository<PlexEpisode, UUID> {

  Optional<PlexEpisode> findByPlexKey(String plexKey);

  boolean existsByPlexKey(String plexKey);
}
