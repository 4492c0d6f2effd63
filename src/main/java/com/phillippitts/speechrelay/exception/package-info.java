/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend a common base. The session controller turns them
 * into {@code error} events for the client; none of them cross the HTTP boundary.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.speechrelay.exception.SpeechRelayException} - Base exception</li>
 *   <li>{@link com.phillippitts.speechrelay.exception.RecognitionUnavailableException} - Credentials
 *       absent or unparseable; recognition disabled</li>
 *   <li>{@link com.phillippitts.speechrelay.exception.StreamStartException} - Backend rejected or
 *       failed to open a streaming call</li>
 *   <li>{@link com.phillippitts.speechrelay.exception.AudioForwardingException} - An audio chunk
 *       could not be sent upstream</li>
 *   <li>{@link com.phillippitts.speechrelay.exception.StreamClosedException} - Write after the
 *       stream ended (benign race, never shown to clients)</li>
 * </ul>
 *
 * @see com.phillippitts.speechrelay.service.session.StreamingSession
 * @since 1.0
 */
package com.phillippitts.speechrelay.exception;
