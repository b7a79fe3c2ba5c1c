package com.couchtv.sources.football;

import com.couchtv.core.cache.FetchException;
import com.couchtv.core.cache.Fetcher;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Fixture lists per category. "Today" is resolved on every fetch.
 */
public class FixtureFetcher implements Fetcher<FootballCategory, List<FootballFixture>> {

    private final FixtureRepository repository;
    private final Clock clock;

    public FixtureFetcher(FixtureRepository repository) {
        this(repository, Clock.systemDefaultZone());
    }

    public FixtureFetcher(FixtureRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public List<FootballFixture> fetch(FootballCategory category) throws FetchException {
        return repository.query(category.filterFor(LocalDate.now(clock)));
    }
}
