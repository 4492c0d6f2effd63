/**
 * REST controllers. Only operational status lives here; speech traffic uses the WebSocket endpoint.
 */
package com.phillippitts.speechrelay.presentation.controller;
