package io.scanner.api.exception;

/** Indicate that the catalog or the client reached a state that should be impossible. */
public class InternalErrorException extends ScannerException {

  public InternalErrorException(String message) {
    super(message);
  }

  public InternalErrorException(String message, Throwable cause) {
    super(message, cause);
  }
}
