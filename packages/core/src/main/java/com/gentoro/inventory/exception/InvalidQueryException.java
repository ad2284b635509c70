package com.gentoro.inventory.exception;

/** Raised for malformed label queries. */
public class InvalidQueryException extends InventoryException {
  public InvalidQueryException(String message) {
    super(InventoryErrorCode.INVALID_QUERY, message);
  }

  public InvalidQueryException(String message, Throwable cause) {
    super(InventoryErrorCode.INVALID_QUERY, message, cause);
  }
}
