package com.couchtv.app.session;

import com.couchtv.app.config.CouchTvConfig;
import com.couchtv.core.cache.Fetcher;
import com.couchtv.core.cache.RequestCoordinator;
import com.couchtv.core.cache.WorkerLauncher;
import com.couchtv.core.epg.EpgProgram;
import com.couchtv.core.epg.EpgTimeline;
import com.couchtv.sources.football.FixtureRepository;
import com.couchtv.sources.football.FootballCategory;
import com.couchtv.sources.football.FootballFixture;
import com.couchtv.sources.image.PosterImageFetcher;
import com.couchtv.sources.tmdb.TmdbCategory;
import com.couchtv.sources.tmdb.TmdbItem;
import com.couchtv.sources.tvmaze.DiscoverCategory;
import com.couchtv.sources.tvmaze.DiscoverItem;
import com.couchtv.sources.xtream.XtreamCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Owns one cache per content source for the lifetime of the window.
 *
 * Everything here runs on the UI thread. Fetchers that depend on settings are looked up
 * per fetch, so changing a key or login takes effect for the next miss; the affected
 * cache is cleared so results fetched under the old settings are dropped.
 */
public class MediaSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MediaSession.class);

    static final String TMDB_KEY_MISSING = "Configure TMDB API key in settings";
    static final String XTREAM_MISSING = "Configure Xtream server in settings";
    static final String FIXTURES_MISSING = "Fixtures database not found. Run the fixtures scraper first.";

    private final CouchTvConfig config;
    private final SourceFactory sources;
    private final FixtureRepository fixtureRepository;

    private volatile Fetcher<TmdbCategory, List<TmdbItem>> tmdbCategoryFetcher;
    private volatile Fetcher<String, List<TmdbItem>> tmdbSearchFetcher;
    private volatile Fetcher<String, List<EpgProgram>> epgFetcher;

    private final RequestCoordinator<TmdbCategory, List<TmdbItem>> tmdbCategories;
    private final RequestCoordinator<String, List<TmdbItem>> tmdbSearch;
    private final RequestCoordinator<DiscoverCategory, List<DiscoverItem>> showDiscovery;
    private final RequestCoordinator<String, List<EpgProgram>> epg;
    private final RequestCoordinator<FootballCategory, List<FootballFixture>> fixtures;
    private final RequestCoordinator<String, BufferedImage> posters;

    public MediaSession(CouchTvConfig config) {
        this(config, new RemoteSources(), Clock.systemUTC(), WorkerLauncher.daemonThreads());
    }

    public MediaSession(CouchTvConfig config, SourceFactory sources, Clock clock, WorkerLauncher launcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.sources = Objects.requireNonNull(sources, "sources");

        this.tmdbCategoryFetcher = sources.tmdbCategories(config.getTmdbApiKey());
        this.tmdbSearchFetcher = sources.tmdbSearch(config.getTmdbApiKey());
        this.epgFetcher = sources.shortEpg(config.getXtreamCredentials());
        this.fixtureRepository = sources.fixtures(Path.of(config.getFixturesDbPath()));

        this.tmdbCategories = new RequestCoordinator<TmdbCategory, List<TmdbItem>>(
                "tmdb", key -> tmdbCategoryFetcher.fetch(key), config.getTmdb().toCachePolicy(), clock, launcher)
            .withAvailability(this::hasTmdbApiKey, TMDB_KEY_MISSING);
        this.tmdbSearch = new RequestCoordinator<String, List<TmdbItem>>(
                "tmdb-search", key -> tmdbSearchFetcher.fetch(key), config.getTmdb().toCachePolicy(), clock, launcher)
            .withAvailability(this::hasTmdbApiKey, TMDB_KEY_MISSING);
        this.showDiscovery = new RequestCoordinator<>(
            "tvmaze", sources.showDiscovery(), config.getTvmaze().toCachePolicy(), clock, launcher);
        this.epg = new RequestCoordinator<String, List<EpgProgram>>(
                "epg", key -> epgFetcher.fetch(key), config.getEpg().toCachePolicy(), clock, launcher)
            .withAvailability(() -> this.config.getXtreamCredentials().isConfigured(), XTREAM_MISSING);
        this.fixtures = new RequestCoordinator<FootballCategory, List<FootballFixture>>(
                "football", sources.fixtureLists(fixtureRepository), config.getFootball().toCachePolicy(), clock, launcher)
            .withAvailability(fixtureRepository::isAvailable, FIXTURES_MISSING);
        this.posters = new RequestCoordinator<>(
            "posters", sources.posters(), config.getImages().toCachePolicy(), clock, launcher);

        log.info("Media session started (TMDB key: {}, Xtream: {}, fixtures database: {})",
            hasTmdbApiKey() ? "set" : "missing",
            config.getXtreamCredentials().isConfigured() ? "set" : "missing",
            fixtureRepository.isAvailable() ? "found" : "missing");
    }

    // ==================== Per-frame ====================

    /**
     * Apply every finished fetch. Call once per frame before reading any cache.
     *
     * @return number of results applied across all caches
     */
    public int processPending() {
        int drained = 0;
        for (RequestCoordinator<?, ?> coordinator : coordinators()) {
            drained += coordinator.processPending();
        }
        return drained;
    }

    public boolean isAnyLoading() {
        for (RequestCoordinator<?, ?> coordinator : coordinators()) {
            if (coordinator.isAnyLoading()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Forget everything cached, e.g. on logout.
     */
    public void clearAll() {
        for (RequestCoordinator<?, ?> coordinator : coordinators()) {
            coordinator.clear();
        }
        log.info("Cleared all content caches");
    }

    // ==================== Convenience ====================

    public void requestEpg(Collection<String> streamIds) {
        epg.requestAll(streamIds);
    }

    /**
     * What is on a stream now and next, from whatever guide data is cached.
     */
    public EpgTimeline epgTimeline(String streamId) {
        return epg.get(streamId).map(EpgTimeline::of).orElse(EpgTimeline.empty());
    }

    /**
     * Request a poster unless the item has none.
     */
    public void requestPoster(String url) {
        if (PosterImageFetcher.isFetchable(url)) {
            posters.request(url);
        }
    }

    // ==================== Settings changes ====================

    public void updateTmdbApiKey(String apiKey) {
        config.setTmdbApiKey(apiKey);
        tmdbCategoryFetcher = sources.tmdbCategories(config.getTmdbApiKey());
        tmdbSearchFetcher = sources.tmdbSearch(config.getTmdbApiKey());
        tmdbCategories.clear();
        tmdbSearch.clear();
        log.info("TMDB API key updated");
    }

    /**
     * Switch Xtream login. Guide data is per panel, so the EPG cache is cleared when anything changed.
     *
     * @return whether the credentials differed from the current ones
     */
    public boolean updateCredentials(XtreamCredentials credentials) {
        Objects.requireNonNull(credentials, "credentials");
        if (credentials.equals(config.getXtreamCredentials())) {
            return false;
        }
        config.setXtreamCredentials(credentials);
        epgFetcher = sources.shortEpg(config.getXtreamCredentials());
        epg.clear();
        log.info("Xtream credentials changed, EPG cache cleared");
        return true;
    }

    // ==================== Caches ====================

    public RequestCoordinator<TmdbCategory, List<TmdbItem>> tmdbCategories() {
        return tmdbCategories;
    }

    public RequestCoordinator<String, List<TmdbItem>> tmdbSearch() {
        return tmdbSearch;
    }

    public RequestCoordinator<DiscoverCategory, List<DiscoverItem>> showDiscovery() {
        return showDiscovery;
    }

    public RequestCoordinator<String, List<EpgProgram>> epg() {
        return epg;
    }

    public RequestCoordinator<FootballCategory, List<FootballFixture>> fixtures() {
        return fixtures;
    }

    public RequestCoordinator<String, BufferedImage> posters() {
        return posters;
    }

    public CouchTvConfig config() {
        return config;
    }

    private boolean hasTmdbApiKey() {
        return !config.getTmdbApiKey().isBlank();
    }

    private List<RequestCoordinator<?, ?>> coordinators() {
        return List.of(tmdbCategories, tmdbSearch, showDiscovery, epg, fixtures, posters);
    }

    @Override
    public void close() {
        for (RequestCoordinator<?, ?> coordinator : coordinators()) {
            coordinator.close();
        }
        if (fixtureRepository instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close fixtures repository", e);
            }
        }
        log.info("Media session closed");
    }
}
