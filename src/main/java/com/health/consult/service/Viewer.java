package com.health.consult.service;

/**
 * Identity of the caller reading patient data. Authentication happens upstream.
 */
public record Viewer(Role role, Long id) {

    public enum Role { PATIENT, PROFESSIONAL }

    public static Viewer patient(Long id) {
        return new Viewer(Role.PATIENT, id);
    }

    public static Viewer professional(Long id) {
        return new Viewer(Role.PROFESSIONAL, id);
    }
}
