package cloud.rentdesk.sdk;

/**
 * Exception representing an error returned by the identity provider or the data API. When the backend responds
 * with a non-2xx status the SDK hydrates this type so callers can inspect both the HTTP status and the error code.
 */
public final class RentdeskApiException extends RentdeskException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;

    public RentdeskApiException(int statusCode, String code, String message) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, code) : message);
        this.statusCode = statusCode;
        this.code = code;
    }

    /**
     * @return HTTP status code returned by the backend.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return backend error code (nullable when the response body did not include one).
     */
    public String getCode() {
        return code;
    }

    private static String defaultMessage(int status, String code) {
        if (code == null || code.isBlank()) {
            return "Rentdesk request failed with status " + status;
        }
        return "Rentdesk request failed with status " + status + " (" + code + ")";
    }
}
