package io.mockdispatch.core.error;

/**
 * Abstract parent for load-time definition errors. Carries the file or resource that caused the
 * error so startup and reload failures can point at it.
 */
public abstract class DefinitionLoadException extends MockDispatchException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected DefinitionLoadException(String message, String source) {
        super(message);
        this.source = source;
    }

    protected DefinitionLoadException(String message, Throwable cause, String source) {
        super(message, cause);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
