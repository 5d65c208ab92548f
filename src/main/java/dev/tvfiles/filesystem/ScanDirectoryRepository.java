package dev.tvfiles.filesystem;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link ScanDirectory} entities. */
public interface ScanDirectoryRepository extends JpaRepository<ScanDirectory, UUID> {

  Optional<ScanDirectory> findByDirname(String dirname);

  List<ScanDirectory> findAllByOrderByDirnameAsc();
}
