package com.phillippitts.speechrelay.presentation.websocket;

import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * JSON envelope for text frames exchanged with the browser client.
 *
 * <p>Inbound: {@code {"event":"startStream"}} or {@code {"event":"endStream"}}. A bare event
 * name ({@code startStream}) is accepted as well. Outbound:
 * {@code {"event":"transcription","data":"..."}} and {@code {"event":"error","data":"..."}}.
 */
@Component
public class RelayMessageCodec {

    static final String EVENT = "event";
    static final String DATA = "data";

    /**
     * Control signals a client may send as text frames.
     */
    public enum ControlEvent {
        START_STREAM("startStream"),
        END_STREAM("endStream");

        private final String wireName;

        ControlEvent(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        static Optional<ControlEvent> fromWireName(String name) {
            for (ControlEvent event : values()) {
                if (event.wireName.equals(name)) {
                    return Optional.of(event);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Events the relay sends as text frames.
     */
    public enum OutboundEvent {
        TRANSCRIPTION("transcription"),
        ERROR("error");

        private final String wireName;

        OutboundEvent(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    /**
     * @return the control event, or empty if the payload is malformed or names an unknown event
     */
    public Optional<ControlEvent> decode(String payload) {
        if (payload == null) {
            return Optional.empty();
        }
        String trimmed = payload.trim();
        if (!trimmed.startsWith("{")) {
            return ControlEvent.fromWireName(trimmed);
        }
        try {
            JSONObject json = new JSONObject(trimmed);
            return ControlEvent.fromWireName(json.optString(EVENT, ""));
        } catch (JSONException e) {
            return Optional.empty();
        }
    }

    public String encode(OutboundEvent event, String data) {
        return new JSONObject()
                .put(EVENT, event.wireName())
                .put(DATA, data == null ? "" : data)
                .toString();
    }
}
