/**
 * WebSocket transport for the relay: frame handling, the JSON text envelope and the
 * outbound {@link com.phillippitts.speechrelay.service.session.ClientChannel} adapter.
 */
package com.phillippitts.speechrelay.presentation.websocket;
