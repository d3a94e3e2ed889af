package com.example.triviaroom.handler;

import com.example.triviaroom.service.Connection;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/** WebSocket-backed connection; sends are serialized by the decorator so timer threads can broadcast. */
public class WebSocketConnection implements Connection {

    private final WebSocketSession session;

    public WebSocketConnection(WebSocketSession raw, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(raw, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String id() { return session.getId(); }

    @Override
    public boolean isOpen() { return session.isOpen(); }

    @Override
    public void send(String text) throws IOException {
        session.sendMessage(new TextMessage(text));
    }

    public WebSocketSession session() { return session; }
}
