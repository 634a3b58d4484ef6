package com.lumenlog.search.exception;

/**
 * Soft failure: the stream is marked for deletion. Callers skip or retry the partition.
 */
public class StreamDeletingException extends SearchException {

    private final String streamName;

    public StreamDeletingException(String streamName) {
        super("stream [" + streamName + "] is being deleted");
        this.streamName = streamName;
    }

    public String getStreamName() {
        return streamName;
    }
}
