package dev.tvfiles.plex;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link PlexSeries} entities. */
public interface PlexSeriesRepository extends JpaRepository<PlexSeries, UUID> {

  Optional<PlexSeries> findByPlexKey(String plexKey);

  boolean existsByPlexKey(String plexKey);
}
