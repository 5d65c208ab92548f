package dev.tvfiles.sonarr;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link SonarrFile} entities. */
public interface SonarrFileRepository extends JpaRepository<SonarrFile, UUID> {

  Optional<SonarrFile> findByFilePath(String filePath);

  boolean existsByFilePath(String filePath);

  List<SonarrFile> findAllByRemovedAtIsNull();
}
