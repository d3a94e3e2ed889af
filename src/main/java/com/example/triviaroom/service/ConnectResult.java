package com.example.triviaroom.service;

import com.example.triviaroom.model.Identity;
import com.example.triviaroom.model.Room;

/** Identity attached on connect, and the room the user was put back into (or null). */
public record ConnectResult(Identity identity, Room rejoinedRoom) {
}
