package dev.tvfiles.sonarr;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link SonarrSeries} entities. */
public interface SonarrSeriesRepository extends JpaRepository<SonarrSeries, UUID> {

  Optional<SonarrSeries> findBySonarrId(int sonarrId);

  boolean existsBySonarrId(int sonarrId);
}
