package com.baykanat.socialsync.domain.error;

/** İstenen kayıt yok → 404. */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
