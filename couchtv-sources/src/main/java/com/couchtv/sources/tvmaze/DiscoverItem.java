package com.couchtv.sources.tvmaze;

/**
 * A TV show card on the discovery screen.
 *
 * @param posterUrl medium-size image, null if TVmaze has none
 * @param rating    average rating, null if unrated
 * @param year      premiere year, null if unknown
 */
public record DiscoverItem(
    long id,
    String title,
    String overview,
    String posterUrl,
    Double rating,
    String year
) {
    double ratingOrZero() {
        return rating != null ? rating : 0.0;
    }
}
