package com.gentoro.inventory.exception;

/** Raised when an operation reaches a component in the wrong lifecycle state. */
public class StateException extends InventoryException {
  public StateException(String message) {
    super(InventoryErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(InventoryErrorCode.STATE_ERROR, message, cause);
  }
}
