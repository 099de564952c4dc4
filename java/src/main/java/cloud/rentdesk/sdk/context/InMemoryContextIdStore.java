package cloud.rentdesk.sdk.context;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

public final class InMemoryContextIdStore implements ContextIdStore {

    private final AtomicReference<String> value = new AtomicReference<>();

    @Override
    public Optional<String> load() {
        return Optional.ofNullable(value.get());
    }

    @Override
    public void save(String contextId) {
        if (contextId == null || contextId.isBlank()) {
            return;
        }
        value.set(contextId);
    }

    @Override
    public void clear() {
        value.set(null);
    }
}
