package com.couchtv.sources.tvmaze;

/**
 * TV show discovery rows backed by TVmaze.
 */
public enum DiscoverCategory {
    AIRING_TODAY("Airing Today", null),
    POPULAR("Popular Shows", null),
    TOP_RATED("Top Rated", null),
    SCI_FI("Sci-Fi", "science-fiction"),
    DRAMA("Drama", "drama"),
    COMEDY("Comedy", "comedy"),
    ACTION("Action", "action");

    private final String displayName;
    private final String genre;

    DiscoverCategory(String displayName, String genre) {
        this.displayName = displayName;
        this.genre = genre;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Genre searched for, or null for the curated rows.
     */
    public String getGenre() {
        return genre;
    }
}
