package com.couchtv.sources.tmdb;

import java.util.Optional;

/**
 * A movie or TV show as shown on a discovery card.
 */
public record TmdbItem(
    long id,
    String title,
    String overview,
    String posterUrl,
    String backdropUrl,
    String releaseDate,
    double voteAverage,
    TmdbContentType contentType
) {
    public Optional<String> year() {
        if (releaseDate != null && releaseDate.length() >= 4) {
            return Optional.of(releaseDate.substring(0, 4));
        }
        return Optional.empty();
    }

    public String contentTypeName() {
        return contentType.getDisplayName();
    }
}
