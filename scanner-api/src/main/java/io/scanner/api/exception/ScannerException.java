package io.scanner.api.exception;

/** Base class of every failure raised by the scanner client. */
public class ScannerException extends RuntimeException {

  public ScannerException(String message) {
    super(message);
  }

  public ScannerException(String message, Throwable cause) {
    super(message, cause);
  }
}
