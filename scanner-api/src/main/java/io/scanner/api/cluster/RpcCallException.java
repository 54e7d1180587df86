package io.scanner.api.cluster;

/** Thrown by {@link ClusterRpc} implementations when a call does not complete. */
public class RpcCallException extends RuntimeException {

  private final RpcStatus status;

  public RpcCallException(RpcStatus status, String message) {
    super(message);
    this.status = status;
  }

  public RpcCallException(RpcStatus status, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  public RpcStatus getStatus() {
    return status;
  }

  @Override
  public String toString() {
    return "RpcCallException(" + status + ": " + getMessage() + ")";
  }
}
