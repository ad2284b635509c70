package com.gentoro.inventory.exception;

/** Raised when an identifier or type tag is registered twice. */
public class AlreadyExistsException extends InventoryException {
  public AlreadyExistsException(String message) {
    super(InventoryErrorCode.ALREADY_EXISTS, message);
  }

  public AlreadyExistsException(String message, Throwable cause) {
    super(InventoryErrorCode.ALREADY_EXISTS, message, cause);
  }
}
