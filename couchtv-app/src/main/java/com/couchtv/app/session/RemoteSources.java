package com.couchtv.app.session;

import com.couchtv.core.cache.Fetcher;
import com.couchtv.core.epg.EpgProgram;
import com.couchtv.sources.football.FixtureFetcher;
import com.couchtv.sources.football.FixtureRepository;
import com.couchtv.sources.football.FootballCategory;
import com.couchtv.sources.football.FootballFixture;
import com.couchtv.sources.football.SqliteFixtureRepository;
import com.couchtv.sources.image.PosterImageFetcher;
import com.couchtv.sources.tmdb.TmdbCategory;
import com.couchtv.sources.tmdb.TmdbClient;
import com.couchtv.sources.tmdb.TmdbItem;
import com.couchtv.sources.tvmaze.DiscoverCategory;
import com.couchtv.sources.tvmaze.DiscoverItem;
import com.couchtv.sources.tvmaze.TvMazeClient;
import com.couchtv.sources.xtream.XtreamClient;
import com.couchtv.sources.xtream.XtreamCredentials;
import com.couchtv.sources.xtream.XtreamEpgFetcher;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;

/**
 * Production sources: TMDB, TVmaze, the Xtream panel, the fixtures database and image hosts.
 */
public class RemoteSources implements SourceFactory {

    @Override
    public Fetcher<TmdbCategory, List<TmdbItem>> tmdbCategories(String apiKey) {
        return new TmdbClient(apiKey).categoryFetcher();
    }

    @Override
    public Fetcher<String, List<TmdbItem>> tmdbSearch(String apiKey) {
        return new TmdbClient(apiKey).searchFetcher();
    }

    @Override
    public Fetcher<DiscoverCategory, List<DiscoverItem>> showDiscovery() {
        return new TvMazeClient().categoryFetcher();
    }

    @Override
    public Fetcher<String, List<EpgProgram>> shortEpg(XtreamCredentials credentials) {
        return new XtreamEpgFetcher(new XtreamClient(credentials));
    }

    @Override
    public FixtureRepository fixtures(Path dbPath) {
        return new SqliteFixtureRepository(dbPath);
    }

    @Override
    public Fetcher<FootballCategory, List<FootballFixture>> fixtureLists(FixtureRepository repository) {
        return new FixtureFetcher(repository);
    }

    @Override
    public Fetcher<String, BufferedImage> posters() {
        return new PosterImageFetcher();
    }
}
