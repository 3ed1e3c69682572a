package com.rolloutstream.core.logs;

/**
 * One item of the multiplexed feed.
 *
 * @param event event name: {@code pods}, {@code log} or {@code ping}
 * @param data  payload, serialized to JSON by the transport
 */
public record StreamMessage(String event, Object data) {}
