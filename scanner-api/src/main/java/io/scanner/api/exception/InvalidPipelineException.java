package io.scanner.api.exception;

/** Indicate that a pipeline can not be compiled into an ordered stage list. */
public class InvalidPipelineException extends ScannerException {

  public InvalidPipelineException(String message) {
    super(message);
  }

  public InvalidPipelineException(String message, Throwable cause) {
    super(message, cause);
  }
}
