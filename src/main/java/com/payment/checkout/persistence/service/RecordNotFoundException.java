package com.payment.checkout.persistence.service;

/**
 * Thrown when a record looked up by id does not exist.
 */
public class RecordNotFoundException extends RuntimeException {

    public RecordNotFoundException(String message) {
        super(message);
    }

    public static RecordNotFoundException of(String recordType, Long id) {
        return new RecordNotFoundException(recordType + " not found: id=" + id);
    }
}
