package io.quorumbridge.observability;

@FunctionalInterface
public interface EventSink {
    EventSink NONE = event -> {
    };

    void publish(LedgerEvent event);
}
