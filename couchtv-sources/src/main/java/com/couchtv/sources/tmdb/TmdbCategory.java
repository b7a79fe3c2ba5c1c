package com.couchtv.sources.tmdb;

/**
 * Trending and popular lists offered on the discovery screen.
 */
public enum TmdbCategory {
    TRENDING_ALL("Trending", "trending/all/day", null),
    TRENDING_MOVIES("Trending Movies", "trending/movie/day", TmdbContentType.MOVIE),
    TRENDING_TV("Trending TV", "trending/tv/day", TmdbContentType.TV_SHOW),
    POPULAR_MOVIES("Popular Movies", "movie/popular", TmdbContentType.MOVIE),
    POPULAR_TV("Popular TV", "tv/popular", TmdbContentType.TV_SHOW),
    TOP_RATED_MOVIES("Top Rated Movies", "movie/top_rated", TmdbContentType.MOVIE),
    TOP_RATED_TV("Top Rated TV", "tv/top_rated", TmdbContentType.TV_SHOW),
    NOW_PLAYING_MOVIES("Now Playing", "movie/now_playing", TmdbContentType.MOVIE),
    AIRING_TODAY_TV("Airing Today", "tv/airing_today", TmdbContentType.TV_SHOW);

    private final String displayName;
    private final String endpoint;
    private final TmdbContentType contentType;

    TmdbCategory(String displayName, String endpoint, TmdbContentType contentType) {
        this.displayName = displayName;
        this.endpoint = endpoint;
        this.contentType = contentType;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /**
     * Content type of every result, or null when the list mixes movies and shows.
     */
    public TmdbContentType getContentType() {
        return contentType;
    }
}
