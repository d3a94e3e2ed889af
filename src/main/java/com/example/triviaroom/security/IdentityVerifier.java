package com.example.triviaroom.security;

import com.example.triviaroom.model.Identity;

import java.util.Map;

/**
 * Turns the credentials of a connection or request into a verified identity.
 * Throws GameException(UNAUTHENTICATED) when the claims are missing or invalid.
 */
public interface IdentityVerifier {

    String USER_ID = "userId";
    String EMAIL = "email";
    String ROLE = "role";
    String DISPLAY_NAME = "displayName";

    Identity verify(Map<String, String> claims);
}
