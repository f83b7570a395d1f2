package net.homeroute.exception;

/**
 * The registry document could not be read, parsed or written.
 */
public class RegistryStorageException extends RuntimeException {

    public RegistryStorageException(String message) {
        super(message);
    }

    public RegistryStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
