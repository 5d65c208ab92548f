package dev.tvfiles.sync;

import static dev.tvfiles.fixture.Observations.file;
import static dev.tvfiles.fixture.Observations.files;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.tvfiles.fixture.InMemoryLifecycleStore;
import dev.tvfiles.fixture.TestKeyModels;
import dev.tvfiles.reconcile.EntityKeyModel;
import dev.tvfiles.reconcile.LifecycleStore;
import dev.tvfiles.reconcile.LinkPolicy;
import dev.tvfiles.reconcile.Observation;
import dev.tvfiles.reconcile.ObservationSource;
import dev.tvfiles.reconcile.PassSummary;
import dev.tvfiles.reconcile.SourceUnavailableException;
import dev.tvfiles.reconcile.StoreUnavailableException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.SimpleTransactionStatus;

@ExtendWith(MockitoExtension.class)
class SyncServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Mock private PlatformTransactionManager transactionManager;
  @Mock private SyncRunRepository syncRunRepository;

  @Captor private ArgumentCaptor<SyncRun> runCaptor;

  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
  private final SyncProperties properties = new SyncProperties(LinkPolicy.INSERT_UNLINKED);
  private final SimpleTransactionStatus transaction = new SimpleTransactionStatus();
  private final AtomicReference<ObservationSource> observations = new AtomicReference<>();

  private InMemoryLifecycleStore store;
  private SyncService syncService;

  /** Filesystem-kind source over the in-memory store whose observations a test can swap. */
  private final class StubSource implements SyncSource {
    @Override
    public SourceKind kind() {
      return SourceKind.FILESYSTEM;
    }

    @Override
    public EntityKeyModel keyModel() {
      return TestKeyModels.flat();
    }

    @Override
    public LifecycleStore store() {
      return store;
    }

    @Override
    public ObservationSource observations() {
      return observations.get();
    }
  }

  @BeforeEach
  void setUp() {
    store = new InMemoryLifecycleStore();
    syncService =
        new SyncService(List.of(new StubSource()), transactionManager, syncRunRepository, properties, clock);
  }

  private void transactionsOpen() {
    when(transactionManager.getTransaction(any())).thenReturn(transaction);
  }

  private void runsAreSaved() {
    when(syncRunRepository.save(any(SyncRun.class))).thenAnswer(invocation -> invocation.getArgument(0));
  }

  @Test
  void successfulPassCommitsAndRecordsCounters() {
    transactionsOpen();
    runsAreSaved();
    observations.set(() -> files("a.mkv", "b.mkv").stream());

    PassSummary summary = syncService.sync(SourceKind.FILESYSTEM);

    assertThat(summary.inserted()).isEqualTo(2);
    verify(transactionManager).commit(transaction);
    verify(transactionManager, never()).rollback(any());
    verify(syncRunRepository, times(2)).save(runCaptor.capture());
    SyncRun run = runCaptor.getValue();
    assertThat(run.getStatus()).isEqualTo(SyncRunStatus.COMPLETED);
    assertThat(run.getSource()).isEqualTo(SourceKind.FILESYSTEM);
    assertThat(run.getFilesSeen()).isEqualTo(2);
    assertThat(run.getFilesInserted()).isEqualTo(2);
    assertThat(run.getFinishedAt()).isEqualTo(NOW);
  }

  @Test
  void sourceFailureRollsBackAndIsRecorded() {
    transactionsOpen();
    runsAreSaved();
    observations.set(
        () ->
            Stream.<Observation>of(file("a.mkv"))
                .peek(
                    o -> {
                      throw new SourceUnavailableException("Plex request failed: timeout");
                    }));

    assertThatThrownBy(() -> syncService.sync(SourceKind.FILESYSTEM))
        .isInstanceOf(SourceUnavailableException.class);

    verify(transactionManager).rollback(transaction);
    verify(transactionManager, never()).commit(any());
    verify(syncRunRepository, times(2)).save(runCaptor.capture());
    assertThat(runCaptor.getValue().getStatus()).isEqualTo(SyncRunStatus.FAILED);
    assertThat(runCaptor.getValue().getErrorMessage()).contains("timeout");
  }

  @Test
  void dataAccessFailureBecomesStoreUnavailable() {
    transactionsOpen();
    runsAreSaved();
    observations.set(
        () -> {
          throw new DataAccessResourceFailureException("connection lost");
        });

    assertThatThrownBy(() -> syncService.sync(SourceKind.FILESYSTEM))
        .isInstanceOf(StoreUnavailableException.class)
        .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    verify(transactionManager).rollback(transaction);
  }

  @Test
  void commitFailureBecomesStoreUnavailable() {
    transactionsOpen();
    runsAreSaved();
    observations.set(() -> files("a.mkv").stream());
    doThrow(new TransactionSystemException("commit failed")).when(transactionManager).commit(transaction);

    assertThatThrownBy(() -> syncService.sync(SourceKind.FILESYSTEM))
        .isInstanceOf(StoreUnavailableException.class)
        .hasMessageContaining("commit failed");
  }

  @Test
  void unwritableRunLogFailsBeforeThePassStarts() {
    when(syncRunRepository.save(any(SyncRun.class)))
        .thenThrow(new DataAccessResourceFailureException("database down"));

    assertThatThrownBy(() -> syncService.sync(SourceKind.FILESYSTEM))
        .isInstanceOf(StoreUnavailableException.class);
    verify(transactionManager, never()).getTransaction(any());
  }

  @Test
  void failureToRecordFailureDoesNotMaskTheCause() {
    transactionsOpen();
    when(syncRunRepository.save(any(SyncRun.class)))
        .thenAnswer(invocation -> invocation.getArgument(0))
        .thenThrow(new DataAccessResourceFailureException("database down"));
    observations.set(
        () -> {
          throw new SourceUnavailableException("Sonarr unreachable");
        });

    assertThatThrownBy(() -> syncService.sync(SourceKind.FILESYSTEM))
        .isInstanceOf(SourceUnavailableException.class)
        .hasMessage("Sonarr unreachable")
        .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
  }

  @Test
  void failureToRecordCompletionKeepsTheCommittedPass() {
    transactionsOpen();
    when(syncRunRepository.save(any(SyncRun.class)))
        .thenAnswer(invocation -> invocation.getArgument(0))
        .thenThrow(new DataAccessResourceFailureException("database down"));
    observations.set(() -> files("a.mkv").stream());

    PassSummary summary = syncService.sync(SourceKind.FILESYSTEM);

    assertThat(summary.inserted()).isEqualTo(1);
    verify(transactionManager).commit(transaction);
    verify(syncRunRepository, times(2)).save(runCaptor.capture());
    assertThat(runCaptor.getAllValues()).allSatisfy(
        run -> assertThat(run.getStatus()).isNotEqualTo(SyncRunStatus.FAILED));
  }

  @Test
  void overlappingPassOfTheSameSourceIsRejected() {
    transactionsOpen();
    runsAreSaved();
    observations.set(
        () -> {
          syncService.sync(SourceKind.FILESYSTEM);
          return Stream.empty();
        });

    assertThatThrownBy(() -> syncService.sync(SourceKind.FILESYSTEM))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("already running");

    observations.set(() -> files("a.mkv").stream());
    assertThat(syncService.sync(SourceKind.FILESYSTEM).inserted()).isEqualTo(1);
  }

  @Test
  void unregisteredSourceIsRejected() {
    assertThatThrownBy(() -> syncService.sync(SourceKind.PLEX))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("plex");
  }

  @Test
  void duplicateSourceRegistrationFails() {
    List<SyncSource> sources = List.of(new StubSource(), new StubSource());

    assertThatThrownBy(
            () -> new SyncService(sources, transactionManager, syncRunRepository, properties, clock))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void lastRunDelegatesToRepository() {
    SyncRun run = new SyncRun(SourceKind.SONARR, NOW);
    when(syncRunRepository.findFirstBySourceOrderByStartedAtDesc(SourceKind.SONARR))
        .thenReturn(Optional.of(run));

    assertThat(syncService.lastRun(SourceKind.SONARR)).containsSame(run);
  }
}
