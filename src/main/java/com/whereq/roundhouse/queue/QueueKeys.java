package com.whereq.roundhouse.queue;

import java.util.UUID;

/**
 * Key layout in the coordination store
 */
public class QueueKeys {

    private final String prefix;

    public QueueKeys(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Sorted set of expedited job ids, scored by priority then admission time
     */
    public String priorityQueue() {
        return prefix + ":queue:priority";
    }

    /**
     * List of FIFO job ids; pushed at the head, claimed from the tail
     */
    public String fifoQueue() {
        return prefix + ":queue:builds";
    }

    public String job(UUID jobId) {
        return prefix + ":job:" + jobId;
    }

    public String logs(UUID jobId) {
        return prefix + ":logs:" + jobId;
    }

    /**
     * Sorted set of callback attempt ids, scored by next retry time
     */
    public String callbackRetry() {
        return prefix + ":queue:callback_retry";
    }

    public String callback(UUID attemptId) {
        return prefix + ":callback:" + attemptId;
    }

    public String activeWorkers() {
        return prefix + ":workers:active";
    }
}
