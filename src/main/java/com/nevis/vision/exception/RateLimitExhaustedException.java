package com.nevis.vision.exception;

import com.nevis.vision.classify.ClassifiedError;
import lombok.Getter;

@Getter
public class RateLimitExhaustedException extends BackendCallException {

    private final int attemptsMade;

    public RateLimitExhaustedException(ClassifiedError error, int attemptsMade) {
        super(error);
        this.attemptsMade = attemptsMade;
    }
}
