package dev.tvfiles.report;

import dev.tvfiles.sync.SourceKind;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A file path, relative to its mount point, that is active in some compared inventories but not
 * in all of them. Both sets iterate in {@link SourceKind} order.
 *
 * @param path the relative path
 * @param presentIn inventories holding an active row for the path
 * @param missingFrom compared inventories without one
 */
public record InventoryMismatch(String path, Set<SourceKind> presentIn, Set<SourceKind> missingFrom) {
  public InventoryMismatch {
    presentIn = ordered(presentIn);
    missingFrom = ordered(missingFrom);
  }

  private static Set<SourceKind> ordered(Set<SourceKind> kinds) {
    EnumSet<SourceKind> copy = EnumSet.noneOf(SourceKind.class);
    copy.addAll(kinds);
    return Collections.unmodifiableSet(copy);
  }
}
