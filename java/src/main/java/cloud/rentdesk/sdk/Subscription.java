package cloud.rentdesk.sdk;

/**
 * Handle returned when registering a listener. Closing it stops further deliveries; closing twice is harmless.
 */
public interface Subscription extends AutoCloseable {

    boolean isActive();

    @Override
    void close();
}
