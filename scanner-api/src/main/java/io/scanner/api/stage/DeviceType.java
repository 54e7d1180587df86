package io.scanner.api.stage;

/** Device a stage's kernel is scheduled on. */
public enum DeviceType {
  CPU,
  GPU
}
