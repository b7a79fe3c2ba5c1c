package com.couchtv.app.session;

import com.couchtv.core.cache.Fetcher;
import com.couchtv.core.epg.EpgProgram;
import com.couchtv.sources.football.FixtureRepository;
import com.couchtv.sources.football.FootballCategory;
import com.couchtv.sources.football.FootballFixture;
import com.couchtv.sources.tmdb.TmdbCategory;
import com.couchtv.sources.tmdb.TmdbItem;
import com.couchtv.sources.tvmaze.DiscoverCategory;
import com.couchtv.sources.tvmaze.DiscoverItem;
import com.couchtv.sources.xtream.XtreamCredentials;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;

/**
 * Creates the fetchers behind a {@link MediaSession}.
 */
public interface SourceFactory {

    Fetcher<TmdbCategory, List<TmdbItem>> tmdbCategories(String apiKey);

    Fetcher<String, List<TmdbItem>> tmdbSearch(String apiKey);

    Fetcher<DiscoverCategory, List<DiscoverItem>> showDiscovery();

    Fetcher<String, List<EpgProgram>> shortEpg(XtreamCredentials credentials);

    FixtureRepository fixtures(Path dbPath);

    Fetcher<FootballCategory, List<FootballFixture>> fixtureLists(FixtureRepository repository);

    Fetcher<String, BufferedImage> posters();
}
