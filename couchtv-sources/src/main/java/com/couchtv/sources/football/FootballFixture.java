package com.couchtv.sources.football;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An upcoming match with the channels broadcasting it.
 *
 * @param fixtureDate ISO date, e.g. "2026-10-19"
 * @param fixtureTime kick-off time as scraped, or null when not announced
 */
public record FootballFixture(
    long id,
    String homeTeam,
    String awayTeam,
    String competition,
    String fixtureDate,
    String fixtureTime,
    String venue,
    List<Broadcaster> broadcasters
) {

    public FootballFixture {
        broadcasters = broadcasters != null ? List.copyOf(broadcasters) : List.of();
    }

    public String matchTitle() {
        return homeTeam + " vs " + awayTeam;
    }

    public String displayTime() {
        return fixtureTime != null && !fixtureTime.isBlank() ? fixtureTime : "TBD";
    }

    public List<String> allChannelNames() {
        List<String> names = new ArrayList<>();
        for (Broadcaster b : broadcasters) {
            names.add(b.channel());
        }
        return names;
    }

    /**
     * Channel names per country, countries in broadcaster order.
     */
    public Map<String, List<String>> channelsByCountry() {
        Map<String, List<String>> byCountry = new LinkedHashMap<>();
        for (Broadcaster b : broadcasters) {
            byCountry.computeIfAbsent(b.country(), c -> new ArrayList<>()).add(b.channel());
        }
        return byCountry;
    }

    FootballFixture withBroadcasters(List<Broadcaster> list) {
        return new FootballFixture(id, homeTeam, awayTeam, competition, fixtureDate, fixtureTime, venue, list);
    }
}
