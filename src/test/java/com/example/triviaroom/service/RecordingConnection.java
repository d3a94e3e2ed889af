package com.example.triviaroom.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.fail;

/** In-memory connection that keeps every frame it was sent. */
final class RecordingConnection implements Connection {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String id;
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failOnSend = false;

    RecordingConnection(String id) {
        this.id = id;
    }

    @Override
    public String id() { return id; }

    @Override
    public boolean isOpen() { return open; }

    @Override
    public void send(String text) throws IOException {
        if (failOnSend) throw new IOException("broken pipe");
        sent.add(text);
    }

    void close() { open = false; }

    void failOnSend() { failOnSend = true; }

    List<JsonNode> frames() {
        List<JsonNode> out = new ArrayList<>();
        for (String s : sent) out.add(parse(s));
        return out;
    }

    List<String> types() {
        List<String> out = new ArrayList<>();
        for (JsonNode n : frames()) out.add(n.path("type").asText());
        return out;
    }

    List<JsonNode> events(String type) {
        List<JsonNode> out = new ArrayList<>();
        for (JsonNode n : frames()) {
            if (type.equals(n.path("type").asText())) out.add(n);
        }
        return out;
    }

    long count(String type) {
        return events(type).size();
    }

    /** Waits until the n-th (1-based) event of this type arrived and returns it. */
    JsonNode await(String type, int occurrence, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            List<JsonNode> found = events(type);
            if (found.size() >= occurrence) return found.get(occurrence - 1);
            Thread.sleep(10);
        }
        fail("no " + type + " #" + occurrence + " within " + timeoutMs + "ms; got " + types());
        return null;
    }

    JsonNode await(String type) throws InterruptedException {
        return await(type, 1, 3000);
    }

    private static JsonNode parse(String s) {
        try {
            return MAPPER.readTree(s);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
