package com.couchtv.sources.http;

import com.couchtv.core.cache.FetchException;
import com.couchtv.core.cache.FetchException.ErrorType;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Blocking GET helper shared by the remote sources.
 * Turns transport failures and error responses into {@link FetchException}s with user-facing messages.
 */
public class ApiClient {

    private static final ObjectMapper mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final OkHttpClient client;
    private final String serviceName;
    private final String errorMessageField;

    /**
     * @param serviceName       name used in messages, e.g. "TMDB"
     * @param errorMessageField JSON field holding the upstream error text, or null
     */
    public ApiClient(OkHttpClient client, String serviceName, String errorMessageField) {
        this.client = client;
        this.serviceName = serviceName;
        this.errorMessageField = errorMessageField;
    }

    public static OkHttpClient newHttpClient(Duration connectTimeout, Duration readTimeout) {
        return new OkHttpClient.Builder()
            .connectTimeout(connectTimeout)
            .readTimeout(readTimeout)
            .build();
    }

    public static ObjectMapper mapper() {
        return mapper;
    }

    /**
     * GET a URL and parse the body as JSON.
     */
    public JsonNode getJson(String url) throws FetchException {
        String body = new String(getBytes(url, "application/json"), StandardCharsets.UTF_8);
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            throw new FetchException(ErrorType.PARSE, "Failed to parse response: " + e.getMessage(), e);
        }
    }

    /**
     * GET a URL and return the raw body.
     */
    public byte[] getBytes(String url, String accept) throws FetchException {
        Request request;
        try {
            request = new Request.Builder()
                .url(url)
                .header("Accept", accept)
                .build();
        } catch (IllegalArgumentException e) {
            throw new FetchException(ErrorType.NOT_CONFIGURED, "Invalid " + serviceName + " URL", e);
        }

        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            byte[] bytes = responseBody != null ? responseBody.bytes() : new byte[0];
            if (!response.isSuccessful()) {
                throw describeErrorResponse(response.code(), new String(bytes, StandardCharsets.UTF_8));
            }
            return bytes;
        } catch (IOException e) {
            throw describeFailure(e);
        }
    }

    /**
     * Map a transport failure to a message the user can act on.
     */
    public FetchException describeFailure(IOException e) {
        String text = String.valueOf(e.getMessage());
        if (e instanceof SSLException || text.toLowerCase().contains("certificate")) {
            return new FetchException(ErrorType.BLOCKED,
                "Network proxy blocking connection. Try using a VPN.", e);
        }
        if (e instanceof InterruptedIOException) {
            return new FetchException(ErrorType.TIMEOUT,
                "Unable to connect to " + serviceName + ". Check your internet connection.", e);
        }
        if (e instanceof ConnectException || e instanceof UnknownHostException) {
            return new FetchException(ErrorType.NETWORK,
                "Unable to connect to " + serviceName + ". Check your internet connection.", e);
        }
        return new FetchException(ErrorType.NETWORK, "Connection error: " + text, e);
    }

    /**
     * Map a non-2xx response. HTML bodies mean something between us and the API answered.
     */
    public FetchException describeErrorResponse(int code, String body) {
        if (body != null && (body.contains("<!DOCTYPE") || body.contains("<html"))) {
            return new FetchException(ErrorType.BLOCKED,
                serviceName + " API blocked by network. Try using a VPN.");
        }
        if (errorMessageField != null && body != null && !body.isBlank()) {
            try {
                JsonNode error = mapper.readTree(body);
                String message = error.path(errorMessageField).asText(null);
                if (message != null && !message.isBlank()) {
                    return new FetchException(ErrorType.API, serviceName + ": " + message);
                }
            } catch (IOException ignored) {
                // Not JSON, fall through to the status code
            }
        }
        return new FetchException(ErrorType.API, "API error: " + code);
    }

    public String serviceName() {
        return serviceName;
    }
}
