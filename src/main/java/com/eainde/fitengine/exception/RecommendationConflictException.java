package com.eainde.fitengine.exception;

/**
 * Second write to a session's final recommendation.
 */
public class RecommendationConflictException extends IntegrityException {

    public RecommendationConflictException(String message) {
        super(message);
    }
}
