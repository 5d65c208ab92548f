package dev.tvfiles.reconcile;

import java.util.stream.Stream;

/**
 * Produces the complete, finite observation set of one source.
 *
 * <p>Each call starts a fresh traversal. The returned stream may be lazy and may hold resources;
 * callers close it. Implementations throw {@link SourceUnavailableException}, either from this
 * method or while the stream is consumed, instead of returning partial data.
 */
@FunctionalInterface
public interface ObservationSource {

  Stream<Observation> observe();
}
