package com.tengen.gtp;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded history of the commands sent to the engine and their responses.
 * The oldest item is dropped once the capacity is reached.
 */
public class GtpLogModel implements GtpClientListener {

    public static final int MIN_SIZE = 5;
    public static final int MAX_SIZE = 1000;

    private final List<GtpLogItem> items = new ArrayList<>();
    private int capacity;

    public GtpLogModel(int capacity) {
        setCapacity(capacity);
    }

    public synchronized int capacity() {
        return capacity;
    }

    /**
     * @throws IllegalArgumentException if the capacity is outside {@value #MIN_SIZE}..{@value #MAX_SIZE}
     */
    public synchronized void setCapacity(int capacity) {
        if (capacity < MIN_SIZE || capacity > MAX_SIZE) {
            throw new IllegalArgumentException(
                    "GTP log size must be between %d and %d, was %d".formatted(MIN_SIZE, MAX_SIZE, capacity));
        }
        this.capacity = capacity;
        trim();
    }

    public synchronized List<GtpLogItem> items() {
        return List.copyOf(items);
    }

    @Override
    public synchronized void commandSent(GtpCommand command) {
        items.add(GtpLogItem.sent(command.text()));
        trim();
    }

    @Override
    public synchronized void responseReceived(GtpCommand command, GtpResponse response, long elapsedNanos) {
        for (int i = items.size() - 1; i >= 0; i--) {
            GtpLogItem item = items.get(i);
            if (!item.hasResponse() && item.command().equals(command.text())) {
                items.set(i, item.answered(response));
                return;
            }
        }
        // failed by a broken stream before it was ever written
        items.add(GtpLogItem.sent(command.text()).answered(response));
        trim();
    }

    private void trim() {
        while (items.size() > capacity) {
            items.remove(0);
        }
    }
}
