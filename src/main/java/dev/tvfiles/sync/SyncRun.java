package dev.tvfiles.sync;

import dev.tvfiles.reconcile.PassSummary;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Log entry for one sync pass of one source.
 *
 * <p>Written in its own transaction before the pass starts and updated after the pass commits or
 * rolls back, so failed passes stay visible. The lifecycle follows {@link SyncRunStatus}.
 *
 * <p>Maps to the {@code sync_runs} table managed by Flyway migrations.
 */
@Entity
@Table(name = "sync_runs")
public class SyncRun {

    private static final int MAX_ERROR_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SourceKind source;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SyncRunStatus status = SyncRunStatus.RUNNING;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "files_seen", nullable = false)
    private int filesSeen;

    @Column(name = "files_inserted", nullable = false)
    private int filesInserted;

    @Column(name = "files_restored", nullable = false)
    private int filesRestored;

    @Column(name = "episodes_linked", nullable = false)
    private int episodesLinked;

    @Column(name = "files_unresolved", nullable = false)
    private int filesUnresolved;

    @Column(name = "files_removed", nullable = false)
    private int filesRemoved;

    @Column(name = "error_message", length = MAX_ERROR_LENGTH)
    private String errorMessage;

    protected SyncRun() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates a run in {@link SyncRunStatus#RUNNING} state.
     *
     * @param source    the source being synced
     * @param startedAt when the pass was requested
     */
    public SyncRun(SourceKind source, Instant startedAt) {
        this.source = source;
        this.startedAt = startedAt;
    }

    /** Record the counters of a committed pass. */
    public void complete(PassSummary summary, Instant finishedAt) {
        this.status = SyncRunStatus.COMPLETED;
        this.finishedAt = finishedAt;
        this.filesSeen = summary.seen();
        this.filesInserted = summary.inserted();
        this.filesRestored = summary.restored();
        this.episodesLinked = summary.linked();
        this.filesUnresolved = summary.unresolved();
        this.filesRemoved = summary.removed();
    }

    /** Record a rolled-back pass. */
    public void fail(String errorMessage, Instant finishedAt) {
        this.status = SyncRunStatus.FAILED;
        this.finishedAt = finishedAt;
        if (errorMessage != null && errorMessage.length() > MAX_ERROR_LENGTH) {
            errorMessage = errorMessage.substring(0, MAX_ERROR_LENGTH);
        }
        this.errorMessage = errorMessage;
    }

    public UUID getId() {
        return id;
    }

    public SourceKind getSource() {
        return source;
    }

    public SyncRunStatus getStatus() {
        return status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public int getFilesSeen() {
        return filesSeen;
    }

    public int getFilesInserted() {
        return filesInserted;
    }

    public int getFilesRestored() {
        return filesRestored;
    }

    public int getEpisodesLinked() {
        return episodesLinked;
    }

    public int getFilesUnresolved() {
        return filesUnresolved;
    }

    public int getFilesRemoved() {
        return filesRemoved;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
