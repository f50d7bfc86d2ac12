package com.example.deltacode.domain;

/**
 * Raised when a file record or a whole inventory is missing required data.
 */
public class MalformedRecordException extends InventoryException {
    public MalformedRecordException(String message) {
        super(message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
