package dev.tvfiles.sync;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link SyncRun} entities. */
public interface SyncRunRepository extends JpaRepository<SyncRun, UUID> {

  /** The most recently started run of a source, used by the status report. */
  Optional<SyncRun> findFirstBySourceOrderByStartedAtDesc(SourceKind source);
}
