package com.phillippitts.speechrelay.domain;

/**
 * Observable state of a streaming session's upstream stream.
 */
public enum StreamState {
    /** No stream installed; audio chunks are dropped. */
    IDLE,
    /** A live stream is installed and accepting audio. */
    STREAMING
}
