package cloud.rentdesk.sdk.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of role binding a context represents.
 */
public enum ContextType {
    OWNER("owner", "Owner"),
    STAFF("staff", "Staff"),
    TENANT("tenant", "Tenant");

    private final String wireValue;
    private final String label;

    ContextType(String wireValue, String label) {
        this.wireValue = wireValue;
        this.label = label;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public String label() {
        return label;
    }

    /**
     * @return the matching type, or {@code null} for blank or unrecognised values. A context without a type is kept
     *     but grants nothing.
     */
    @JsonCreator
    public static ContextType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ContextType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
