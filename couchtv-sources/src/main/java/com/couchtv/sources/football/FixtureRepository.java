package com.couchtv.sources.football;

import com.couchtv.core.cache.FetchException;

import java.util.List;

/**
 * Source of scraped football fixtures.
 */
public interface FixtureRepository {

    /**
     * Fixtures matching the filter, ordered by date then kick-off time, broadcasters attached.
     */
    List<FootballFixture> query(FixtureFilter filter) throws FetchException;

    /**
     * Whether there is anything to query yet.
     */
    boolean isAvailable();
}
