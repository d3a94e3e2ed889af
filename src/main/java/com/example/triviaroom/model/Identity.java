package com.example.triviaroom.model;

/** Verified caller identity attached to a connection or request. */
public record Identity(String userId, String email, String role, String displayName) {
}
