package com.couchtv.sources.football;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Fixture query: an inclusive date range, open-ended when {@code to} is null,
 * optionally narrowed to competitions whose name contains a string.
 */
public record FixtureFilter(LocalDate from, LocalDate to, String competition) {

    public FixtureFilter {
        Objects.requireNonNull(from, "from");
        if (to != null && to.isBefore(from)) {
            throw new IllegalArgumentException("to before from: " + from + " > " + to);
        }
    }

    public static FixtureFilter on(LocalDate day) {
        return new FixtureFilter(day, day, null);
    }

    public static FixtureFilter between(LocalDate from, LocalDate to) {
        return new FixtureFilter(from, to, null);
    }

    public static FixtureFilter upcoming(LocalDate from, String competition) {
        return new FixtureFilter(from, null, competition);
    }

    public boolean hasCompetition() {
        return competition != null && !competition.isBlank();
    }
}
