package com.couchtv.sources.football;

import java.time.LocalDate;

/**
 * Fixture lists offered in the football view.
 */
public enum FootballCategory {
    TODAY("Today", null),
    TOMORROW("Tomorrow", null),
    THIS_WEEK("This Week", null),
    PREMIER_LEAGUE("Premier League", "Premier League"),
    LA_LIGA("La Liga", "La Liga"),
    SERIE_A("Serie A", "Serie A"),
    BUNDESLIGA("Bundesliga", "Bundesliga"),
    LIGUE_1("Ligue 1", "Ligue 1"),
    CHAMPIONS_LEAGUE("Champions League", "Champions League");

    private static final int WEEK_DAYS = 7;

    private final String displayName;
    private final String competition;

    FootballCategory(String displayName, String competition) {
        this.displayName = displayName;
        this.competition = competition;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Query for this category as seen on the given day.
     */
    public FixtureFilter filterFor(LocalDate today) {
        return switch (this) {
            case TODAY -> FixtureFilter.on(today);
            case TOMORROW -> FixtureFilter.on(today.plusDays(1));
            case THIS_WEEK -> FixtureFilter.between(today, today.plusDays(WEEK_DAYS));
            default -> FixtureFilter.upcoming(today, competition);
        };
    }
}
