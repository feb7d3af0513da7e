package io.mockdispatch.core.error;

/** Thrown when a definitions document has invalid syntax, missing fields or invalid values. */
public final class DefinitionParseException extends DefinitionLoadException {

    private static final long serialVersionUID = 1L;

    public DefinitionParseException(String message, String source) {
        super(message, source);
    }

    public DefinitionParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
