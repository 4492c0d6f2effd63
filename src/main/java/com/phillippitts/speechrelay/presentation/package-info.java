/**
 * Presentation layer: the WebSocket relay endpoint plus a small REST surface for status.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.websocket} - relay endpoint, JSON envelope, outbound channel</li>
 *   <li>{@code presentation.controller} - status endpoint</li>
 *   <li>{@code presentation.exception} - HTTP error mapping</li>
 * </ul>
 *
 * <p>Presentation depends on service, never the other way round.
 *
 * @since 1.0
 */
package com.phillippitts.speechrelay.presentation;
