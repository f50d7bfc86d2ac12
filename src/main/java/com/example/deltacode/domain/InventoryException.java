package com.example.deltacode.domain;

/**
 * Base type for failures caused by an invalid file inventory.
 */
public class InventoryException extends RuntimeException {
    public InventoryException(String message) {
        super(message);
    }

    public InventoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
