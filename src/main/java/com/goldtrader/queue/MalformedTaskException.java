package com.goldtrader.queue;

import lombok.Getter;

/**
 * A queued payload that cannot be handed to a handler: unreadable JSON, a stale envelope
 * version, or a missing or out-of-range field.
 */
@Getter
public class MalformedTaskException extends RuntimeException {

    /** Null when the payload was not readable far enough to recover it. */
    private final String processingId;

    public MalformedTaskException(String message, String processingId) {
        super(message);
        this.processingId = processingId;
    }

    public MalformedTaskException(String message, Throwable cause) {
        super(message, cause);
        this.processingId = null;
    }
}
