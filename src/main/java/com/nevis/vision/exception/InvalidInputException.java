package com.nevis.vision.exception;

import lombok.experimental.StandardException;

/**
 * Caller supplied an empty or malformed argument. Raised before any backend is contacted.
 */
@StandardException
public class InvalidInputException extends RuntimeException {
}
