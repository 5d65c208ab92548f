package dev.tvfiles.reconcile;

/** The persistence layer failed mid-pass. Fatal; staged writes are rolled back. */
public class StoreUnavailableException extends RuntimeException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
