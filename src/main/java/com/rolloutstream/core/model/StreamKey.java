package com.rolloutstream.core.model;

/**
 * Identifies one container log tail.
 */
public record StreamKey(String pod, String container) {

    @Override
    public String toString() {
        return pod + "/" + container;
    }
}
