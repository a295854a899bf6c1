package com.rubyast.json;

/**
 * A tree could not be written to or read from JSON.
 *
 * <p>{@link #getNodeType()} names the variant being written, or the root variant that
 * was expected when reading.</p>
 */
public class AstJsonException extends RuntimeException {

    private final String nodeType;

    public AstJsonException(String nodeType, String message, Throwable cause) {
        super(message, cause);
        this.nodeType = nodeType;
    }

    public String getNodeType() {
        return nodeType;
    }
}
