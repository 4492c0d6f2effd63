/**
 * Per-connection streaming sessions.
 *
 * <p>{@link com.phillippitts.speechrelay.service.session.StreamingSession} is the state machine
 * that binds a client connection to one upstream recognition stream;
 * {@link com.phillippitts.speechrelay.service.session.SessionRegistry} creates and disposes of
 * sessions as connections come and go. Nothing here depends on the WebSocket API: the transport
 * is reached through {@link com.phillippitts.speechrelay.service.session.ClientChannel}.
 *
 * @since 1.0
 */
package com.phillippitts.speechrelay.service.session;
