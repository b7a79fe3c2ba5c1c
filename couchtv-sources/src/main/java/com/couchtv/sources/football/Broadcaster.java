package com.couchtv.sources.football;

/**
 * A channel showing a fixture in one country.
 */
public record Broadcaster(String country, String channel) {}
