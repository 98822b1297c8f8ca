package com.health.consult.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Unguessable per-appointment video room links.
 */
@Component
public class MeetingLinkGenerator {

    private static final int TOKEN_BYTES = 16;

    private final SecureRandom random = new SecureRandom();
    private final String baseUrl;

    public MeetingLinkGenerator(@Value("${consult.meeting.base-url:https://meet.healthconsult.com/}") String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    }

    public String generate() {
        byte[] token = new byte[TOKEN_BYTES];
        random.nextBytes(token);
        return baseUrl + Base64.getUrlEncoder().withoutPadding().encodeToString(token);
    }
}
