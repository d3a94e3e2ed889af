package com.example.triviaroom.security;

import com.example.triviaroom.error.ErrorCode;
import com.example.triviaroom.error.GameException;
import com.example.triviaroom.model.Identity;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Accepts claims already verified by the upstream auth layer (gateway headers or
 * handshake query). Only shape is checked here.
 */
@Component
public class TrustedClaimsIdentityVerifier implements IdentityVerifier {

    private static final Pattern USER_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_\\-.:@]{1,64}$");
    private static final int MAX_NAME = 40;

    @Override
    public Identity verify(Map<String, String> claims) {
        if (claims == null) throw unauthenticated("Missing credentials");

        String userId = trimToNull(claims.get(USER_ID));
        String email = trimToNull(claims.get(EMAIL));
        if (userId == null || email == null) throw unauthenticated("userId and email are required");
        if (!USER_ID_PATTERN.matcher(userId).matches()) throw unauthenticated("Malformed userId");
        if (!email.contains("@")) throw unauthenticated("Malformed email");

        String role = trimToNull(claims.get(ROLE));
        role = (role == null) ? "user" : role.toLowerCase(Locale.ROOT);

        String displayName = trimToNull(claims.get(DISPLAY_NAME));
        if (displayName == null) displayName = email.substring(0, email.indexOf('@'));
        if (displayName.isEmpty()) displayName = userId;
        if (displayName.length() > MAX_NAME) displayName = displayName.substring(0, MAX_NAME);

        return new Identity(userId, email, role, displayName);
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static GameException unauthenticated(String message) {
        return new GameException(ErrorCode.UNAUTHENTICATED, message);
    }
}
