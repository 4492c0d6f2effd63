package com.phillippitts.speechrelay.testutil;

import com.phillippitts.speechrelay.service.session.ClientChannel;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ClientChannel that records every outbound event, in order, as {@code "transcription:<text>"}
 * or {@code "error:<message>"}.
 */
public class RecordingClientChannel implements ClientChannel {

    private final String id;
    private final List<String> events = new CopyOnWriteArrayList<>();

    public RecordingClientChannel(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void sendTranscription(String text) {
        events.add("transcription:" + text);
    }

    @Override
    public void sendError(String message) {
        events.add("error:" + message);
    }

    public List<String> events() {
        return events;
    }

    public List<String> transcriptions() {
        return events.stream()
                .filter(e -> e.startsWith("transcription:"))
                .map(e -> e.substring("transcription:".length()))
                .toList();
    }

    public List<String> errors() {
        return events.stream()
                .filter(e -> e.startsWith("error:"))
                .map(e -> e.substring("error:".length()))
                .toList();
    }
}
