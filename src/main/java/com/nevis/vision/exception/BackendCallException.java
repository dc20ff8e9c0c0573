package com.nevis.vision.exception;

import com.nevis.vision.classify.ClassifiedError;
import lombok.Getter;

@Getter
public class BackendCallException extends RuntimeException {

    private final ClassifiedError error;

    public BackendCallException(ClassifiedError error) {
        super(error.code() + ": " + error.message());
        this.error = error;
    }

    public BackendCallException(ClassifiedError error, Throwable cause) {
        super(error.code() + ": " + error.message(), cause);
        this.error = error;
    }
}
