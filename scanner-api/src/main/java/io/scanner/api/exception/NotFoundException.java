package io.scanner.api.exception;

/** Indicate that a collection, table, job or registered type does not exist. */
public class NotFoundException extends ScannerException {

  public NotFoundException(String message) {
    super(message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
