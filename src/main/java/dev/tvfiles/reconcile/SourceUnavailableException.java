package dev.tvfiles.reconcile;

/**
 * An observation source could not be reached or read. Fatal for the pass: nothing it staged is
 * committed.
 */
public class SourceUnavailableException extends RuntimeException {

  public SourceUnavailableException(String message) {
    super(message);
  }

  public SourceUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
