package com.couchtv.sources.tmdb;

public enum TmdbContentType {
    MOVIE("Movie"),
    TV_SHOW("TV Show");

    private final String displayName;

    TmdbContentType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
