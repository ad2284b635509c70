package com.gentoro.inventory.exception;

/** Stable error codes surfaced by the inventory core to its callers. */
public enum InventoryErrorCode {
  /** A resource failed its own self-validation. */
  VALIDATION_FAILED,
  /** An identifier or type tag is already registered. */
  ALREADY_EXISTS,
  /** An identifier or type tag is not registered. */
  NOT_FOUND,
  /** A label query is malformed. */
  INVALID_QUERY,
  /** The label store is not in a state that accepts the operation. */
  STATE_ERROR,
  /** Replacing a resource in the label indices could not complete and was rolled back. */
  INDEX_UPDATE_FAILED,
  CONFIGURATION_ERROR,
  CODEC_ERROR,
  UNKNOWN
}
