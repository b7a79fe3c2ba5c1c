package com.couchtv.sources.tmdb;

import com.couchtv.core.cache.FetchException;
import com.couchtv.core.cache.FetchException.ErrorType;
import com.couchtv.core.cache.Fetcher;
import com.couchtv.sources.http.ApiClient;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Client for trending, popular and search lists from the TMDB API.
 */
public class TmdbClient {

    private static final Logger log = LoggerFactory.getLogger(TmdbClient.class);

    public static final String API_BASE = "https://api.themoviedb.org/3";
    static final String IMAGE_BASE = "https://image.tmdb.org/t/p";
    private static final int MAX_CATEGORY_RESULTS = 20;
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final String apiKey;
    private final String baseUrl;
    private final ApiClient api;

    public TmdbClient(String apiKey) {
        this(apiKey, API_BASE, ApiClient.newHttpClient(TIMEOUT, TIMEOUT));
    }

    public TmdbClient(String apiKey, String baseUrl, OkHttpClient httpClient) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.api = new ApiClient(httpClient, "TMDB", "status_message");
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * First-page results for a discovery category.
     */
    public List<TmdbItem> getByCategory(TmdbCategory category, int page) throws FetchException {
        requireApiKey();
        JsonNode response = api.getJson(buildUrl(category.getEndpoint() + "?page=" + page));
        return parseResults(response, category.getContentType(), MAX_CATEGORY_RESULTS);
    }

    /**
     * Movies and TV shows matching a query. People are skipped.
     */
    public List<TmdbItem> searchMulti(String query, int page) throws FetchException {
        requireApiKey();
        String encoded = URLEncoder.encode(query, StandardCharsets.UTF_8);
        JsonNode response = api.getJson(buildUrl("search/multi?query=" + encoded + "&page=" + page));
        return parseResults(response, null, Integer.MAX_VALUE);
    }

    public Fetcher<TmdbCategory, List<TmdbItem>> categoryFetcher() {
        return category -> getByCategory(category, 1);
    }

    public Fetcher<String, List<TmdbItem>> searchFetcher() {
        return query -> searchMulti(query, 1);
    }

    String buildUrl(String endpoint) {
        String separator = endpoint.contains("?") ? "&" : "?";
        return baseUrl + "/" + endpoint + separator + "api_key=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8);
    }

    private void requireApiKey() throws FetchException {
        if (!hasApiKey()) {
            throw new FetchException(ErrorType.NOT_CONFIGURED, "Configure TMDB API key in settings");
        }
    }

    /**
     * Convert a paginated TMDB response into items.
     *
     * @param fixedType content type of every result, or null to read each result's media_type
     */
    static List<TmdbItem> parseResults(JsonNode response, TmdbContentType fixedType, int limit) throws FetchException {
        JsonNode results = response.path("results");
        if (!results.isArray()) {
            throw new FetchException(ErrorType.PARSE, "Invalid response format");
        }

        List<TmdbItem> items = new ArrayList<>();
        for (JsonNode result : results) {
            if (items.size() >= limit) break;

            TmdbContentType type = fixedType != null ? fixedType : mediaType(result);
            if (type == null) continue;

            try {
                TmdbItem item = type == TmdbContentType.MOVIE
                    ? ApiClient.mapper().treeToValue(result, MovieResult.class).toItem()
                    : ApiClient.mapper().treeToValue(result, TvResult.class).toItem();
                if (item != null) {
                    items.add(item);
                }
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed TMDB result: {}", e.getMessage());
            }
        }
        return items;
    }

    private static TmdbContentType mediaType(JsonNode result) {
        return switch (result.path("media_type").asText("")) {
            case "movie" -> TmdbContentType.MOVIE;
            case "tv" -> TmdbContentType.TV_SHOW;
            default -> null;
        };
    }

    private static String imageUrl(String size, String path) {
        return path != null && !path.isBlank() ? IMAGE_BASE + "/" + size + path : null;
    }

    // ==================== Response DTOs ====================

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MovieResult(
        @JsonProperty("id") long id,
        @JsonProperty("title") String title,
        @JsonProperty("overview") String overview,
        @JsonProperty("poster_path") String posterPath,
        @JsonProperty("backdrop_path") String backdropPath,
        @JsonProperty("release_date") String releaseDate,
        @JsonProperty("vote_average") double voteAverage
    ) {
        TmdbItem toItem() {
            if (title == null) return null;
            return new TmdbItem(id, title, overview != null ? overview : "",
                imageUrl("w342", posterPath), imageUrl("w780", backdropPath),
                releaseDate != null ? releaseDate : "", voteAverage, TmdbContentType.MOVIE);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TvResult(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("overview") String overview,
        @JsonProperty("poster_path") String posterPath,
        @JsonProperty("backdrop_path") String backdropPath,
        @JsonProperty("first_air_date") String firstAirDate,
        @JsonProperty("vote_average") double voteAverage
    ) {
        TmdbItem toItem() {
            if (name == null) return null;
            return new TmdbItem(id, name, overview != null ? overview : "",
                imageUrl("w342", posterPath), imageUrl("w780", backdropPath),
                firstAirDate != null ? firstAirDate : "", voteAverage, TmdbContentType.TV_SHOW);
        }
    }
}
