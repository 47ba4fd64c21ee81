package com.umitunal.batchq.error;

import java.util.concurrent.TimeoutException;

/**
 * Raised by the timeout guard when a processor outlives the configured item timeout.
 */
public class ItemTimeoutException extends TimeoutException {
    private final String itemId;
    private final long timeoutMillis;

    public ItemTimeoutException(String itemId, long timeoutMillis) {
        super("Operation timeout after " + timeoutMillis + "ms");
        this.itemId = itemId;
        this.timeoutMillis = timeoutMillis;
    }

    public String getItemId() { return itemId; }
    public long getTimeoutMillis() { return timeoutMillis; }
}
