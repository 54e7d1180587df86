package io.scanner.api.exception;

/** Indicate that a lookup key has a type the lookup does not accept. */
public class InvalidIdentifierException extends ScannerException {

  public InvalidIdentifierException(String message) {
    super(message);
  }

  public InvalidIdentifierException(String message, Throwable cause) {
    super(message, cause);
  }
}
