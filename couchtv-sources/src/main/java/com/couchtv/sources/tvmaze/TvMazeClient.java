package com.couchtv.sources.tvmaze;

import com.couchtv.core.cache.FetchException;
import com.couchtv.core.cache.FetchException.ErrorType;
import com.couchtv.core.cache.Fetcher;
import com.couchtv.sources.http.ApiClient;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.OkHttpClient;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Client for TV show discovery from the TVmaze API (no API key needed).
 */
public class TvMazeClient {

    private static final Logger log = LoggerFactory.getLogger(TvMazeClient.class);

    public static final String API_BASE = "https://api.tvmaze.com";
    private static final int MAX_RESULTS = 20;
    private static final int MIN_GENRE_MATCHES = 10;
    private static final double TOP_RATED_THRESHOLD = 7.0;
    private static final Duration TIMEOUT = Duration.ofSeconds(15);

    private static final Comparator<DiscoverItem> BY_RATING_DESC =
        Comparator.comparingDouble(DiscoverItem::ratingOrZero).reversed();

    private final String baseUrl;
    private final ApiClient api;

    public TvMazeClient() {
        this(API_BASE, ApiClient.newHttpClient(TIMEOUT, TIMEOUT));
    }

    public TvMazeClient(String baseUrl, OkHttpClient httpClient) {
        this.baseUrl = baseUrl;
        this.api = new ApiClient(httpClient, "TVmaze", null);
    }

    public List<DiscoverItem> getByCategory(DiscoverCategory category) throws FetchException {
        return switch (category) {
            case AIRING_TODAY -> getAiringToday();
            case POPULAR -> getPopular();
            case TOP_RATED -> getTopRated();
            case SCI_FI, DRAMA, COMEDY, ACTION -> getByGenre(category.getGenre());
        };
    }

    public Fetcher<DiscoverCategory, List<DiscoverItem>> categoryFetcher() {
        return this::getByCategory;
    }

    /**
     * Today's schedule, one entry per show.
     */
    public List<DiscoverItem> getAiringToday() throws FetchException {
        return scheduleToItems(api.getJson(baseUrl + "/schedule"));
    }

    /**
     * TVmaze has no popularity endpoint; a broad search sorted by rating stands in for it.
     */
    public List<DiscoverItem> getPopular() throws FetchException {
        List<DiscoverItem> items = new ArrayList<>(toItems(searchShows("the"), MAX_RESULTS));
        items.sort(BY_RATING_DESC);
        return items;
    }

    public List<DiscoverItem> getTopRated() throws FetchException {
        List<DiscoverItem> items = new ArrayList<>();
        for (DiscoverItem item : toItems(searchShows("best"), Integer.MAX_VALUE)) {
            if (item.ratingOrZero() >= TOP_RATED_THRESHOLD) {
                items.add(item);
            }
        }
        items.sort(BY_RATING_DESC);
        return items.size() > MAX_RESULTS ? new ArrayList<>(items.subList(0, MAX_RESULTS)) : items;
    }

    /**
     * Shows tagged with the genre. Falls back to the plain search results when too few are tagged.
     */
    public List<DiscoverItem> getByGenre(String genre) throws FetchException {
        List<ShowResult> shows = searchShows(genre);
        String wanted = genre.toLowerCase(Locale.ROOT);

        List<ShowResult> matching = new ArrayList<>();
        for (ShowResult show : shows) {
            if (show.hasGenreLike(wanted)) {
                matching.add(show);
            }
        }

        List<DiscoverItem> items = matching.size() < MIN_GENRE_MATCHES
            ? new ArrayList<>(toItems(shows, MAX_RESULTS))
            : new ArrayList<>(toItems(matching, MAX_RESULTS));
        items.sort(BY_RATING_DESC);
        return items;
    }

    private List<ShowResult> searchShows(String query) throws FetchException {
        String encoded = URLEncoder.encode(query, StandardCharsets.UTF_8);
        return parseSearchResults(api.getJson(baseUrl + "/search/shows?q=" + encoded));
    }

    // ==================== Parsing ====================

    static List<ShowResult> parseSearchResults(JsonNode response) throws FetchException {
        if (!response.isArray()) {
            throw new FetchException(ErrorType.PARSE, "Invalid response format");
        }
        List<ShowResult> shows = new ArrayList<>();
        for (JsonNode result : response) {
            ShowResult show = readShow(result.path("show"));
            if (show != null) {
                shows.add(show);
            }
        }
        return shows;
    }

    static List<DiscoverItem> scheduleToItems(JsonNode schedule) throws FetchException {
        if (!schedule.isArray()) {
            throw new FetchException(ErrorType.PARSE, "Invalid response format");
        }
        Set<Long> seen = new HashSet<>();
        List<DiscoverItem> items = new ArrayList<>();
        for (JsonNode entry : schedule) {
            if (items.size() >= MAX_RESULTS) break;
            ShowResult show = readShow(entry.path("show"));
            if (show != null && seen.add(show.id())) {
                items.add(show.toItem());
            }
        }
        return items;
    }

    private static ShowResult readShow(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        try {
            ShowResult show = ApiClient.mapper().treeToValue(node, ShowResult.class);
            return show.name() != null ? show : null;
        } catch (JsonProcessingException e) {
            log.debug("Skipping malformed TVmaze show: {}", e.getMessage());
            return null;
        }
    }

    private static List<DiscoverItem> toItems(List<ShowResult> shows, int limit) {
        List<DiscoverItem> items = new ArrayList<>();
        for (ShowResult show : shows) {
            if (items.size() >= limit) break;
            items.add(show.toItem());
        }
        return items;
    }

    /**
     * Plain text from a TVmaze HTML summary.
     */
    static String cleanSummary(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parseBodyFragment(html).text().trim();
    }

    // ==================== Response DTOs ====================

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ShowResult(long id, String name, String summary, Image image, Rating rating,
                      List<String> genres, String premiered) {

        boolean hasGenreLike(String lowerGenre) {
            if (genres == null) return false;
            for (String g : genres) {
                if (g != null && g.toLowerCase(Locale.ROOT).contains(lowerGenre)) {
                    return true;
                }
            }
            return false;
        }

        DiscoverItem toItem() {
            String year = premiered != null && !premiered.isBlank() ? premiered.split("-")[0] : null;
            return new DiscoverItem(
                id,
                name,
                cleanSummary(summary),
                image != null ? image.medium() : null,
                rating != null ? rating.average() : null,
                year
            );
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Image(String medium, String original) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Rating(Double average) {}
}
