package com.baykanat.socialsync.domain.error;

/** Kayıt var ama işlem izni yok → 403. */
public class PermissionDeniedException extends RuntimeException {

    public PermissionDeniedException(String message) {
        super(message);
    }
}
