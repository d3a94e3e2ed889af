package com.example.triviaroom.service;

import java.io.IOException;

/** A live client connection, independent of the transport that carries it. */
public interface Connection {

    String id();

    boolean isOpen();

    void send(String text) throws IOException;
}
