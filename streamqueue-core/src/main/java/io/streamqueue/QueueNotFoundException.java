package io.streamqueue;

/**
 * Thrown when a run id is neither registered locally nor confirmed to exist by the backend.
 *
 * <p>Callers should not retry: the run either never existed here or its queue has expired.
 */
public final class QueueNotFoundException extends RuntimeException {

    private final String queueId;

    public QueueNotFoundException(String queueId) {
        super("Queue with id '" + queueId + "' does not exist");
        this.queueId = queueId;
    }

    public String queueId() {
        return queueId;
    }
}
