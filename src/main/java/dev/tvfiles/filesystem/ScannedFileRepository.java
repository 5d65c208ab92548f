package dev.tvfiles.filesystem;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link ScannedFile} entities. */
public interface ScannedFileRepository extends JpaRepository<ScannedFile, UUID> {

  Optional<ScannedFile> findByFilenameAndFilepath(String filename, String filepath);

  boolean existsByFilenameAndFilepath(String filename, String filepath);

  /** Every file not currently marked removed, read in one query for pass finalization. */
  List<ScannedFile> findAllByRemovedAtIsNull();
}
