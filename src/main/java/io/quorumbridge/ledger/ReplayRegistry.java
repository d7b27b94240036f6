package io.quorumbridge.ledger;

import io.quorumbridge.model.Bytes32;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Remembers the most recent {@code capacity} inbound transfer ids. Once full, each insert evicts the
 * oldest id, which then becomes acceptable again.
 */
public final class ReplayRegistry {
    private final Bytes32[] slots;
    private final Set<Bytes32> members = new HashSet<>();
    private long cursor;

    public ReplayRegistry(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Replay capacity must be positive");
        }
        this.slots = new Bytes32[capacity];
    }

    public boolean contains(Bytes32 transferId) {
        return members.contains(transferId);
    }

    public void insert(Bytes32 transferId) {
        if (members.contains(transferId)) {
            throw new IllegalStateException("Transfer id already recorded: " + transferId);
        }
        int slot = (int) (cursor % slots.length);
        Bytes32 evicted = slots[slot];
        if (evicted != null) {
            members.remove(evicted);
        }
        slots[slot] = transferId;
        members.add(transferId);
        cursor++;
    }

    public int size() {
        return members.size();
    }

    public int capacity() {
        return slots.length;
    }

    public long cursor() {
        return cursor;
    }

    /**
     * Occupied slots in slot order. Slots fill from zero, so this is always a prefix of the ring.
     */
    public List<Bytes32> slots() {
        List<Bytes32> out = new ArrayList<>();
        for (Bytes32 slot : slots) {
            if (slot == null) {
                break;
            }
            out.add(slot);
        }
        return out;
    }

    public void restore(List<Bytes32> occupied, long cursor) {
        if (occupied.size() > slots.length) {
            throw new IllegalArgumentException("Replay snapshot exceeds capacity " + slots.length);
        }
        Arrays.fill(slots, null);
        members.clear();
        for (int i = 0; i < occupied.size(); i++) {
            slots[i] = occupied.get(i);
            members.add(occupied.get(i));
        }
        this.cursor = cursor;
    }
}
