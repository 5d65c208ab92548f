package dev.tvfiles.fixture;

import dev.tvfiles.reconcile.Attributes;
import dev.tvfiles.reconcile.EntityKind;
import dev.tvfiles.reconcile.LifecycleStore;
import dev.tvfiles.reconcile.Lineage;
import dev.tvfiles.reconcile.NaturalKey;
import dev.tvfiles.reconcile.StoredEntity;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.springframework.dao.DuplicateKeyException;

/**
 * {@link LifecycleStore} backed by maps, enforcing the same uniqueness and foreign-key rules as
 * the Flyway schema. Records the order of inserts so tests can check parents are written first.
 */
public final class InMemoryLifecycleStore implements LifecycleStore {

  private final Map<EntityKind, Map<NaturalKey, Row>> rows = new EnumMap<>(EntityKind.class);
  private final Map<UUID, Row> rowsById = new LinkedHashMap<>();
  private final List<EntityKind> insertOrder = new ArrayList<>();

  public InMemoryLifecycleStore() {
    for (EntityKind kind : EntityKind.values()) {
      rows.put(kind, new LinkedHashMap<>());
    }
  }

  @Override
  public Optional<StoredEntity> findByKey(EntityKind kind, NaturalKey key) {
    Row row = rows.get(kind).get(key);
    return row == null ? Optional.empty() : Optional.of(new StoredEntity(row.id, row.removedAt));
  }

  @Override
  public UUID insert(
      EntityKind kind, NaturalKey key, Attributes attributes, Lineage lineage, Instant observedAt) {
    if (rows.get(kind).containsKey(key)) {
      throw new DuplicateKeyException(kind + " already stored: " + key);
    }
    requireParent(lineage.seriesId(), EntityKind.SERIES);
    requireParent(lineage.episodeId(), EntityKind.EPISODE);

    Row row = new Row(UUID.randomUUID(), kind, key, attributes, lineage, observedAt);
    rows.get(kind).put(key, row);
    rowsById.put(row.id, row);
    insertOrder.add(kind);
    return row.id;
  }

  @Override
  public Map<NaturalKey, UUID> listActiveLeafKeys() {
    Map<NaturalKey, UUID> active = new LinkedHashMap<>();
    rows.get(EntityKind.FILE).forEach((key, row) -> {
      if (row.removedAt == null) {
        active.put(key, row.id);
      }
    });
    return active;
  }

  @Override
  public void markRemoved(UUID leafId, Instant removedAt) {
    Row row = leaf(leafId);
    if (row.removedAt != null) {
      throw new IllegalStateException("Already removed: " + row.key);
    }
    row.removedAt = removedAt;
  }

  @Override
  public void clearRemoved(UUID leafId) {
    Row row = leaf(leafId);
    if (row.removedAt == null) {
      throw new IllegalStateException("Not removed: " + row.key);
    }
    row.removedAt = null;
  }

  public Row row(EntityKind kind, NaturalKey key) {
    Row row = rows.get(kind).get(key);
    if (row == null) {
      throw new AssertionError("No " + kind + " row for " + key);
    }
    return row;
  }

  public int count(EntityKind kind) {
    return rows.get(kind).size();
  }

  public List<EntityKind> insertOrder() {
    return List.copyOf(insertOrder);
  }

  /** A comparable view of every row: kind, key, lineage and removal state, in insertion order. */
  public String snapshot() {
    return rowsById.values().stream()
        .map(row -> row.kind + " " + row.key + " series=" + row.lineage.seriesId()
            + " episode=" + row.lineage.episodeId() + " added=" + row.addedAt
            + " removed=" + row.removedAt)
        .collect(Collectors.joining("\n"));
  }

  private Row leaf(UUID id) {
    Row row = rowsById.get(id);
    if (row == null || row.kind != EntityKind.FILE) {
      throw new IllegalStateException("No file row " + id);
    }
    return row;
  }

  private void requireParent(@Nullable UUID id, EntityKind kind) {
    if (id != null && (rowsById.get(id) == null || rowsById.get(id).kind != kind)) {
      throw new IllegalStateException("Dangling " + kind + " reference " + id);
    }
  }

  /** One stored row. Only {@code removedAt} changes after insert. */
  public static final class Row {
    private final UUID id;
    private final EntityKind kind;
    private final NaturalKey key;
    private final Attributes attributes;
    private final Lineage lineage;
    private final Instant addedAt;
    private @Nullable Instant removedAt;

    private Row(
        UUID id,
        EntityKind kind,
        NaturalKey key,
        Attributes attributes,
        Lineage lineage,
        Instant addedAt) {
      this.id = id;
      this.kind = kind;
      this.key = key;
      this.attributes = attributes;
      this.lineage = lineage;
      this.addedAt = addedAt;
    }

    public UUID id() {
      return id;
    }

    public Attributes attributes() {
      return attributes;
    }

    public Lineage lineage() {
      return lineage;
    }

    public Instant addedAt() {
      return addedAt;
    }

    public @Nullable Instant removedAt() {
      return removedAt;
    }
  }
}
