package com.payment.checkout.persistence.service;

/**
 * Thrown when deleting a record that other rows still reference. Foreign keys
 * restrict such deletes; this is raised before the database would reject them.
 */
public class RecordInUseException extends RuntimeException {

    public RecordInUseException(String message) {
        super(message);
    }
}
