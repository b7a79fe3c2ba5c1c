package com.couchtv.sources.image;

import com.couchtv.core.cache.FetchException;
import com.couchtv.core.cache.FetchException.ErrorType;
import com.couchtv.core.cache.Fetcher;
import com.couchtv.sources.http.ApiClient;
import okhttp3.OkHttpClient;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;

/**
 * Downloads poster and channel logo images by URL.
 */
public class PosterImageFetcher implements Fetcher<String, BufferedImage> {

    private static final Duration TIMEOUT = Duration.ofSeconds(15);

    private final ApiClient api;

    public PosterImageFetcher() {
        this(ApiClient.newHttpClient(TIMEOUT, TIMEOUT));
    }

    public PosterImageFetcher(OkHttpClient httpClient) {
        this.api = new ApiClient(httpClient, "image server", null);
    }

    /**
     * Whether a URL is worth requesting at all.
     */
    public static boolean isFetchable(String url) {
        return url != null && !url.isBlank();
    }

    @Override
    public BufferedImage fetch(String url) throws FetchException {
        if (!isFetchable(url)) {
            throw new FetchException(ErrorType.NOT_CONFIGURED, "No image URL");
        }
        return decode(api.getBytes(url, "image/*"));
    }

    static BufferedImage decode(byte[] bytes) throws FetchException {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
            if (image == null) {
                throw new FetchException(ErrorType.PARSE, "Unsupported image format");
            }
            return image;
        } catch (IOException e) {
            throw new FetchException(ErrorType.PARSE, "Failed to decode image: " + e.getMessage(), e);
        }
    }
}
