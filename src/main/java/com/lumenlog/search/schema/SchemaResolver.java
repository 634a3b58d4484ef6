package com.lumenlog.search.schema;

import java.util.Optional;

/**
 * Read access to the schema registry.
 *
 * Implementations report registry failures as
 * {@link com.lumenlog.search.exception.UpstreamIoException}.
 */
public interface SchemaResolver {

    /**
     * Current schema of a stream, or empty when the stream does not exist
     */
    Optional<StreamSchema> getSchema(String org, String stream, StreamType type);

    StreamSettings getSettings(String org, String stream, StreamType type);

    /**
     * True while the stream is marked for deletion
     */
    boolean isDeleting(String org, String stream, StreamType type);
}
