package in.vouchguard.network;

/**
 * Transport or protocol failure talking to the trust network.
 */
public class NetworkException extends RuntimeException {

    private final int statusCode;

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public NetworkException(int statusCode, String message) {
        super(String.format("HTTP %d: %s", statusCode, message));
        this.statusCode = statusCode;
    }

    /**
     * HTTP status, or -1 when the call never got a response.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
