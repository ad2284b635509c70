package com.gentoro.inventory.exception;

/** A resource or payload failed validation. */
public class ValidationException extends InventoryException {
  public ValidationException(String message) {
    super(InventoryErrorCode.VALIDATION_FAILED, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(InventoryErrorCode.VALIDATION_FAILED, message, cause);
  }
}
