package cloud.rentdesk.sdk;

/**
 * Base exception thrown by the Rentdesk identity SDK.
 */
public class RentdeskException extends Exception {

    private static final long serialVersionUID = 1L;

    public RentdeskException(String message) {
        super(message);
    }

    public RentdeskException(String message, Throwable cause) {
        super(message, cause);
    }
}
