package io.chatsync.remote;

/**
 * A call to the remote store failed (network, HTTP status, malformed response).
 */
public class RemoteStoreException extends Exception {

    public static final int NO_STATUS = -1;

    private final int status;

    public RemoteStoreException(String message) {
        this(message, NO_STATUS, null);
    }

    public RemoteStoreException(String message, Throwable cause) {
        this(message, NO_STATUS, cause);
    }

    public RemoteStoreException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * HTTP-like status reported by the backend, or {@link #NO_STATUS} for transport failures.
     */
    public int status() {
        return status;
    }
}
