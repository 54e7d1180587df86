package io.scanner.api.exception;

/** Indicate that a collection or table would be overwritten without force. */
public class AlreadyExistsException extends ScannerException {

  public AlreadyExistsException(String message) {
    super(message);
  }

  public AlreadyExistsException(String message, Throwable cause) {
    super(message, cause);
  }
}
