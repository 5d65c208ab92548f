package dev.tvfiles.plex;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link PlexFile} entities. */
public interface PlexFileRepository extends JpaRepository<PlexFile, UUID> {

  Optional<PlexFile> findByFilenameAndFilepath(String filename, String filepath);

  boolean existsByFilenameAndFilepath(String filename, String filepath);

  List<PlexFile> findAllByRemovedAtIsNull();
}
