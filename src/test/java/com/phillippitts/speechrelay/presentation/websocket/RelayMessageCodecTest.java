package com.phillippitts.speechrelay.presentation.websocket;

import com.phillippitts.speechrelay.presentation.websocket.RelayMessageCodec.ControlEvent;
import com.phillippitts.speechrelay.presentation.websocket.RelayMessageCodec.OutboundEvent;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RelayMessageCodecTest {

    private final RelayMessageCodec codec = new RelayMessageCodec();

    @Test
    void decodesJsonControlEvents() {
        assertThat(codec.decode("{\"event\":\"startStream\"}")).contains(ControlEvent.START_STREAM);
        assertThat(codec.decode("{\"event\":\"endStream\"}")).contains(ControlEvent.END_STREAM);
    }

    @Test
    void decodesBareEventNames() {
        assertThat(codec.decode("startStream")).contains(ControlEvent.START_STREAM);
        assertThat(codec.decode("  endStream\n")).contains(ControlEvent.END_STREAM);
    }

    @Test
    void rejectsUnknownOrMalformedPayloads() {
        assertThat(codec.decode("{\"event\":\"binaryData\"}")).isEmpty();
        assertThat(codec.decode("{\"type\":\"startStream\"}")).isEmpty();
        assertThat(codec.decode("{not json")).isEmpty();
        assertThat(codec.decode("")).isEmpty();
        assertThat(codec.decode(null)).isEmpty();
    }

    @Test
    void encodesTranscriptionEvent() {
        JSONObject json = new JSONObject(codec.encode(OutboundEvent.TRANSCRIPTION, "hello \"world\""));

        assertThat(json.getString("event")).isEqualTo("transcription");
        assertThat(json.getString("data")).isEqualTo("hello \"world\"");
    }

    @Test
    void encodesErrorEventWithEmptyDataForNull() {
        JSONObject json = new JSONObject(codec.encode(OutboundEvent.ERROR, null));

        assertThat(json.getString("event")).isEqualTo("error");
        assertThat(json.getString("data")).isEmpty();
    }
}
