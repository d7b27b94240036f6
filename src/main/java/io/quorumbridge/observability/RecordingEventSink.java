package io.quorumbridge.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Keeps published events in memory, in publication order.
 */
public final class RecordingEventSink implements EventSink {
    private final List<LedgerEvent> events = new ArrayList<>();

    @Override
    public synchronized void publish(LedgerEvent event) {
        events.add(event);
    }

    public synchronized List<LedgerEvent> events() {
        return List.copyOf(events);
    }

    public synchronized <T extends LedgerEvent> List<T> ofType(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (LedgerEvent event : events) {
            if (type.isInstance(event)) {
                out.add(type.cast(event));
            }
        }
        return out;
    }

    public <T extends LedgerEvent> Optional<T> last(Class<T> type) {
        List<T> matching = ofType(type);
        return matching.isEmpty() ? Optional.empty() : Optional.of(matching.get(matching.size() - 1));
    }

    public synchronized List<LedgerEvent> drain() {
        List<LedgerEvent> out = List.copyOf(events);
        events.clear();
        return out;
    }
}
