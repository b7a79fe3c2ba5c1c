package com.couchtv.sources.xtream;

/**
 * Login for an Xtream Codes panel.
 */
public record XtreamCredentials(String serverUrl, String username, String password) {

    public XtreamCredentials {
        serverUrl = serverUrl != null ? serverUrl.trim() : "";
        username = username != null ? username : "";
        password = password != null ? password : "";
    }

    public static XtreamCredentials none() {
        return new XtreamCredentials("", "", "");
    }

    public boolean isConfigured() {
        return !serverUrl.isEmpty();
    }

    /**
     * Server URL without trailing slash, with a scheme.
     */
    public String baseUrl() {
        String url = serverUrl;
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        if (!url.isEmpty() && !url.startsWith("http://") && !url.startsWith("https://")) {
            url = "http://" + url;
        }
        return url;
    }

    @Override
    public String toString() {
        return "XtreamCredentials[serverUrl=" + serverUrl + ", username=" + username + "]";
    }
}
