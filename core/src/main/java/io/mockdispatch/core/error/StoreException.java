package io.mockdispatch.core.error;

/**
 * Thrown when the record store cannot read or persist a collection. Not retried by the core;
 * the dispatcher maps it to a generic 500 response.
 */
public final class StoreException extends MockDispatchException {

    private static final long serialVersionUID = 1L;

    private final String resourceName;

    public StoreException(String message, String resourceName, Throwable cause) {
        super(message, cause);
        this.resourceName = resourceName;
    }

    /** The collection being read or written, or {@code null} for whole-store operations. */
    public String resourceName() {
        return resourceName;
    }
}
