package com.eainde.fitengine.exception;

/**
 * A lower-authority gap category ended up active while a higher one had fired.
 */
public class AuthorityConflictException extends IntegrityException {

    public AuthorityConflictException(String message) {
        super(message);
    }
}
