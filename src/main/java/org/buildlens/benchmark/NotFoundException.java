package org.buildlens.benchmark;

/**
 * Raised when a referenced benchmark config, result or result history does not exist.
 */
public final class NotFoundException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String reference;

    public NotFoundException(String message, String reference) {
        super(message);
        this.reference = reference;
    }

    public String reference() {
        return reference;
    }
}
