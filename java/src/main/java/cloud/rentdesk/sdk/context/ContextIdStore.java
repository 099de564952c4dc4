package cloud.rentdesk.sdk.context;

import java.util.Optional;

/**
 * Client-side memory of the last active context id, read at cold start, written on every successful switch and
 * cleared on sign-out. Implementations report I/O problems through logging and never throw.
 */
public interface ContextIdStore {

    String KEY = "currentContextId";

    Optional<String> load();

    void save(String contextId);

    void clear();
}
