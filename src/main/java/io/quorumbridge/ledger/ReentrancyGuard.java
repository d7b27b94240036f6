package io.quorumbridge.ledger;

import io.quorumbridge.model.LedgerException;
import io.quorumbridge.model.Rejection;

import java.util.function.Supplier;

final class ReentrancyGuard {
    private boolean entered;

    <T> T call(Supplier<T> body) {
        if (entered) {
            throw new LedgerException(Rejection.REENTRANT_CALL);
        }
        entered = true;
        try {
            return body.get();
        } finally {
            entered = false;
        }
    }

    void run(Runnable body) {
        call(() -> {
            body.run();
            return null;
        });
    }
}
