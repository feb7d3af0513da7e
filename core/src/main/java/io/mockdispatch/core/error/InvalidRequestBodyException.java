package io.mockdispatch.core.error;

/** Thrown when a mutating request carries a body that is not a JSON object. */
public final class InvalidRequestBodyException extends MockDispatchException {

    private static final long serialVersionUID = 1L;

    public InvalidRequestBodyException(String message) {
        super(message);
    }

    public InvalidRequestBodyException(String message, Throwable cause) {
        super(message, cause);
    }
}
