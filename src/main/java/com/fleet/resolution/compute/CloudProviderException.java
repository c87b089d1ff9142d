package com.fleet.resolution.compute;

/**
 * Runtime exception raised by the compute inventory and by resolution operations.
 * Callers branch on {@link #getKind()} rather than on exception subtypes.
 */
public class CloudProviderException extends RuntimeException {

    private final ErrorKind kind;

    public CloudProviderException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CloudProviderException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static CloudProviderException notFound(String message) {
        return new CloudProviderException(ErrorKind.NOT_FOUND, message);
    }

    public static CloudProviderException upstream(String message, Throwable cause) {
        return new CloudProviderException(ErrorKind.UPSTREAM, message, cause);
    }

    public static CloudProviderException upstream(String message) {
        return new CloudProviderException(ErrorKind.UPSTREAM, message);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isNotFound() {
        return kind == ErrorKind.NOT_FOUND;
    }
}
