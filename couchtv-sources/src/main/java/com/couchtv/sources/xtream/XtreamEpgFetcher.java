package com.couchtv.sources.xtream;

import com.couchtv.core.cache.FetchException;
import com.couchtv.core.cache.FetchException.ErrorType;
import com.couchtv.core.cache.Fetcher;
import com.couchtv.core.epg.EpgProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Short EPG per stream id. Panels often drop the first call under load, so each fetch
 * gets a second attempt before a single outcome is reported.
 */
public class XtreamEpgFetcher implements Fetcher<String, List<EpgProgram>> {

    private static final Logger log = LoggerFactory.getLogger(XtreamEpgFetcher.class);

    static final int DEFAULT_ATTEMPTS = 2;
    static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(500);

    private final Fetcher<String, List<EpgProgram>> delegate;
    private final int attempts;
    private final Duration retryDelay;

    public XtreamEpgFetcher(XtreamClient client) {
        this(client::getShortEpg, DEFAULT_ATTEMPTS, DEFAULT_RETRY_DELAY);
    }

    XtreamEpgFetcher(Fetcher<String, List<EpgProgram>> delegate, int attempts, Duration retryDelay) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1: " + attempts);
        }
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.attempts = attempts;
        this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay");
    }

    @Override
    public List<EpgProgram> fetch(String streamId) throws FetchException {
        FetchException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return delegate.fetch(streamId);
            } catch (FetchException e) {
                if (e.getType() == ErrorType.NOT_CONFIGURED) {
                    throw e;
                }
                last = e;
                if (attempt < attempts) {
                    log.debug("EPG attempt {} for stream {} failed: {}", attempt, streamId, e.getMessage());
                    pause();
                }
            }
        }
        throw last;
    }

    private void pause() throws FetchException {
        if (retryDelay.isZero()) {
            return;
        }
        try {
            Thread.sleep(retryDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(ErrorType.UNKNOWN, "EPG fetch interrupted", e);
        }
    }
}
