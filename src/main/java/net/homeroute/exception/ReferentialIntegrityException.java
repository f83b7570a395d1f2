package net.homeroute.exception;

/**
 * An entity cannot be removed while other entities still reference it.
 */
public class ReferentialIntegrityException extends RegistryValidationException {

    private final int referenceCount;

    public ReferentialIntegrityException(String message, int referenceCount) {
        super(message);
        this.referenceCount = referenceCount;
    }

    public int getReferenceCount() {
        return referenceCount;
    }
}
