package com.nevis.vision.exception;

import lombok.experimental.StandardException;

/**
 * A backend answered, but its body could not be turned into the canonical result shape.
 */
@StandardException
public class MalformedPayloadException extends RuntimeException {
}
