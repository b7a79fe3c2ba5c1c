package com.couchtv.sources.xtream;

import com.couchtv.core.cache.FetchException;
import com.couchtv.core.cache.FetchException.ErrorType;
import com.couchtv.core.epg.EpgProgram;
import com.couchtv.sources.http.ApiClient;
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
 * Program guide calls against an Xtream Codes player API.
 */
public class XtreamClient {

    private static final Logger log = LoggerFactory.getLogger(XtreamClient.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(15);
    // Overloaded panels can take well over a minute to answer
    private static final Duration READ_TIMEOUT = Duration.ofSeconds(120);
    private static final int SHORT_EPG_LIMIT = 4;

    private final XtreamCredentials credentials;
    private final ApiClient api;

    public XtreamClient(XtreamCredentials credentials) {
        this(credentials, ApiClient.newHttpClient(CONNECT_TIMEOUT, READ_TIMEOUT));
    }

    public XtreamClient(XtreamCredentials credentials, OkHttpClient httpClient) {
        this.credentials = credentials;
        this.api = new ApiClient(httpClient, "EPG", null);
    }

    /**
     * Current and next few programs for a live stream.
     */
    public List<EpgProgram> getShortEpg(String streamId) throws FetchException {
        if (!credentials.isConfigured()) {
            throw new FetchException(ErrorType.NOT_CONFIGURED, "No Xtream server configured");
        }
        String url = playerApiUrl("get_short_epg") + "&stream_id=" + encode(streamId) + "&limit=" + SHORT_EPG_LIMIT;
        return parseListings(api.getJson(url), streamId);
    }

    private String playerApiUrl(String action) {
        return credentials.baseUrl() + "/player_api.php?username=" + encode(credentials.username())
            + "&password=" + encode(credentials.password()) + "&action=" + action;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    // ==================== Parsing ====================

    /**
     * Read {@code epg_listings}. A response without listings means no guide data, not an error.
     * Listings without usable times are skipped.
     */
    static List<EpgProgram> parseListings(JsonNode response, String streamId) {
        List<EpgProgram> programs = new ArrayList<>();
        JsonNode listings = response.path("epg_listings");
        if (!listings.isArray()) {
            return programs;
        }

        int skipped = 0;
        for (JsonNode listing : listings) {
            long start = unixSeconds(listing, "start_timestamp", "start");
            long end = unixSeconds(listing, "stop_timestamp", "end", "stop");
            if (start <= 0 || end <= 0) {
                skipped++;
                continue;
            }
            String channelId = firstText(listing, "epg_id", "channel_id");
            programs.add(new EpgProgram(
                channelId.isEmpty() ? streamId : channelId,
                listing.path("title").asText(""),
                listing.path("description").asText(""),
                start,
                end
            ));
        }
        if (skipped > 0) {
            log.debug("Skipped {} EPG listings without times for stream {}", skipped, streamId);
        }
        return programs;
    }

    /**
     * First field that holds unix seconds, as a number or a numeric string. 0 if none or out of range.
     */
    private static long unixSeconds(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.path(field);
            if (value.isNumber()) {
                return value.canConvertToLong() ? value.asLong() : 0;
            }
            if (value.isTextual()) {
                String text = value.asText().trim();
                if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
                    try {
                        return Long.parseLong(text);
                    } catch (NumberFormatException e) {
                        return 0;
                    }
                }
            }
        }
        return 0;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String text = node.path(field).asText("");
            if (!text.isEmpty()) {
                return text;
            }
        }
        return "";
    }
}
