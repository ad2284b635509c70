package com.gentoro.inventory.exception;

import java.time.Instant;
import java.util.Map;

/** Structured, serialisable view of a failure. */
public record ErrorDetails(
    String type,
    String message,
    InventoryErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
