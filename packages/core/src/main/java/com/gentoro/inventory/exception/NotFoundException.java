package com.gentoro.inventory.exception;

/** Raised when an identifier or type tag is not registered. */
public class NotFoundException extends InventoryException {
  public NotFoundException(String message) {
    super(InventoryErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(InventoryErrorCode.NOT_FOUND, message, cause);
  }
}
