package com.couchtv.sources.http;

import com.couchtv.core.cache.FetchException;
import com.couchtv.core.cache.FetchException.ErrorType;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import static org.junit.jupiter.api.Assertions.*;

class ApiClientTest {

    private StubHttp http;
    private ApiClient api;

    @BeforeEach
    void setUp() {
        http = new StubHttp();
        api = new ApiClient(http.client(), "TMDB", "status_message");
    }

    @Nested
    @DisplayName("Transport failures")
    class TransportFailures {

        @Test
        void certificateProblemsLookLikeAProxy() {
            FetchException e = api.describeFailure(new SSLHandshakeException("PKIX path building failed"));
            assertEquals(ErrorType.BLOCKED, e.getType());
            assertEquals("Network proxy blocking connection. Try using a VPN.", e.getMessage());

            FetchException byText = api.describeFailure(new IOException("bad certificate chain"));
            assertEquals(ErrorType.BLOCKED, byText.getType());
        }

        @Test
        void timeoutsAndRefusedConnectionsAskToCheckTheConnection() {
            FetchException timeout = api.describeFailure(new SocketTimeoutException("timeout"));
            assertEquals(ErrorType.TIMEOUT, timeout.getType());
            assertEquals("Unable to connect to TMDB. Check your internet connection.", timeout.getMessage());
            assertTrue(timeout.isTransient());

            assertEquals(ErrorType.NETWORK, api.describeFailure(new ConnectException("refused")).getType());
            assertEquals(ErrorType.NETWORK, api.describeFailure(new UnknownHostException("api.themoviedb.org")).getType());
        }

        @Test
        void otherFailuresKeepTheirMessage() {
            FetchException e = api.describeFailure(new IOException("stream reset"));
            assertEquals(ErrorType.NETWORK, e.getType());
            assertEquals("Connection error: stream reset", e.getMessage());
        }
    }

    @Nested
    @DisplayName("Error responses")
    class ErrorResponses {

        @Test
        void htmlBodyMeansBlocked() {
            FetchException e = api.describeErrorResponse(403, "<!DOCTYPE html><html><body>Access denied</body></html>");
            assertEquals(ErrorType.BLOCKED, e.getType());
            assertEquals("TMDB API blocked by network. Try using a VPN.", e.getMessage());
        }

        @Test
        void upstreamMessageIsSurfaced() {
            FetchException e = api.describeErrorResponse(401,
                "{\"status_code\":7,\"status_message\":\"Invalid API key: You must be granted a valid key.\"}");
            assertEquals(ErrorType.API, e.getType());
            assertEquals("TMDB: Invalid API key: You must be granted a valid key.", e.getMessage());
        }

        @Test
        void fallsBackToStatusCode() {
            assertEquals("API error: 500", api.describeErrorResponse(500, "oops").getMessage());
            assertEquals("API error: 404", api.describeErrorResponse(404, "").getMessage());
        }
    }

    @Nested
    @DisplayName("Requests")
    class Requests {

        @Test
        void parsesJsonBody() throws FetchException {
            http.respondJson("{\"page\":1}");

            JsonNode node = api.getJson("https://api.example.test/list");

            assertEquals(1, node.path("page").asInt());
            assertEquals("https://api.example.test/list", http.requestedUrls().get(0));
        }

        @Test
        void badJsonIsAParseError() {
            http.respondJson("{not json");

            FetchException e = assertThrows(FetchException.class, () -> api.getJson("https://api.example.test/list"));
            assertEquals(ErrorType.PARSE, e.getType());
            assertTrue(e.getMessage().startsWith("Failed to parse response: "));
        }

        @Test
        void errorStatusGoesThroughResponseMapping() {
            http.respond(401, "{\"status_message\":\"Invalid API key\"}");

            FetchException e = assertThrows(FetchException.class, () -> api.getJson("https://api.example.test/list"));
            assertEquals("TMDB: Invalid API key", e.getMessage());
        }

        @Test
        void transportErrorGoesThroughFailureMapping() {
            http.fail(new SocketTimeoutException("read timed out"));

            FetchException e = assertThrows(FetchException.class, () -> api.getJson("https://api.example.test/list"));
            assertEquals(ErrorType.TIMEOUT, e.getType());
        }

        @Test
        void malformedUrlIsNotConfiguredAndNotEchoed() {
            FetchException e = assertThrows(FetchException.class,
                () -> api.getJson("player_api.php?username=me&password=secret"));
            assertEquals(ErrorType.NOT_CONFIGURED, e.getType());
            assertFalse(e.getMessage().contains("secret"));
            assertTrue(http.requestedUrls().isEmpty());
        }
    }
}
