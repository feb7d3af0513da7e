package io.mockdispatch.core.error;

/**
 * Abstract base for all mock-dispatch exceptions. Never thrown directly; use one of the
 * concrete subclasses. Every subclass is unchecked so the dispatcher boundary is the single
 * place that converts failures into HTTP responses.
 */
public abstract class MockDispatchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected MockDispatchException(String message) {
        super(message);
    }

    protected MockDispatchException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
