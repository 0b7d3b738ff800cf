package com.memstack.ingest.exception;

import lombok.Getter;

/**
 * The graph engine failed to write an episode. The only unrecoverable failure of
 * the episode pipeline; the owning item record is moved to FAILED before this propagates.
 */
@Getter
public class EpisodeIngestionException extends TaskProcessingException {

    private final String episodeId;

    public EpisodeIngestionException(String episodeId, String message, Throwable cause) {
        super(message, cause);
        this.episodeId = episodeId;
    }
}
