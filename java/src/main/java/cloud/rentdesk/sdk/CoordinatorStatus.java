package cloud.rentdesk.sdk;

/**
 * Lifecycle of a {@link SessionCoordinator}.
 */
public enum CoordinatorStatus {
    UNINITIALIZED,
    INITIALIZING,
    READY,
    ERROR
}
