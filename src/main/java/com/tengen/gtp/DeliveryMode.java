package com.tengen.gtp;

/**
 * How the submitting caller waits for a response.
 */
public enum DeliveryMode {
    /** Return immediately; the continuation runs later on the client's dispatcher thread. */
    ASYNC,
    /** Suspend the calling thread until the response has been dispatched. */
    BLOCK_UNTIL_DONE
}
