package io.scanner.api.exception;

/** Wraps a failed call to the cluster control plane. */
public class RemoteCallException extends ScannerException {

  public RemoteCallException(String message) {
    super(message);
  }

  public RemoteCallException(String message, Throwable cause) {
    super(message, cause);
  }
}
