package com.couchtv.sources.football;

import com.couchtv.core.cache.FetchException;
import com.couchtv.core.cache.FetchException.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Read-only access to the fixtures database written by the fixtures scraper.
 * One lazily opened connection, shared by the fetch workers under a lock.
 */
public class SqliteFixtureRepository implements FixtureRepository, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SqliteFixtureRepository.class);

    private static final String FIXTURE_COLUMNS =
        "SELECT id, home_team, away_team, competition, fixture_date, fixture_time, venue FROM fixtures";

    private final Path dbPath;
    private Connection connection;

    public SqliteFixtureRepository(Path dbPath) {
        this.dbPath = dbPath;
    }

    @Override
    public boolean isAvailable() {
        return dbPath != null && Files.isReadable(dbPath);
    }

    @Override
    public synchronized List<FootballFixture> query(FixtureFilter filter) throws FetchException {
        if (!isAvailable()) {
            throw new FetchException(ErrorType.NOT_CONFIGURED,
                "Fixtures database not found. Run the fixtures scraper first.");
        }

        var sql = new StringBuilder(FIXTURE_COLUMNS);
        List<String> params = new ArrayList<>();

        if (filter.to() != null && filter.to().equals(filter.from())) {
            sql.append(" WHERE fixture_date = ?");
            params.add(filter.from().toString());
        } else {
            sql.append(" WHERE fixture_date >= ?");
            params.add(filter.from().toString());
            if (filter.to() != null) {
                sql.append(" AND fixture_date <= ?");
                params.add(filter.to().toString());
            }
        }
        if (filter.hasCompetition()) {
            sql.append(" AND competition LIKE ?");
            params.add("%" + filter.competition() + "%");
        }
        sql.append(" ORDER BY fixture_date ASC, fixture_time ASC");

        try {
            Connection c = getConnection();
            List<FootballFixture> fixtures = new ArrayList<>();
            try (PreparedStatement stmt = c.prepareStatement(sql.toString())) {
                for (int i = 0; i < params.size(); i++) {
                    stmt.setString(i + 1, params.get(i));
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        fixtures.add(readFixture(rs));
                    }
                }
            }

            List<FootballFixture> withChannels = new ArrayList<>(fixtures.size());
            for (FootballFixture fixture : fixtures) {
                withChannels.add(fixture.withBroadcasters(loadBroadcasters(c, fixture.id())));
            }
            log.debug("Loaded {} fixtures for {}", withChannels.size(), filter);
            return withChannels;
        } catch (SQLException e) {
            throw new FetchException(ErrorType.UNKNOWN, "Failed to query fixtures: " + e.getMessage(), e);
        }
    }

    private List<Broadcaster> loadBroadcasters(Connection c, long fixtureId) throws SQLException {
        List<Broadcaster> broadcasters = new ArrayList<>();
        try (PreparedStatement stmt = c.prepareStatement(
                "SELECT country, channel FROM broadcasters WHERE fixture_id = ? ORDER BY country, channel")) {
            stmt.setLong(1, fixtureId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    broadcasters.add(new Broadcaster(rs.getString("country"), rs.getString("channel")));
                }
            }
        }
        return broadcasters;
    }

    private FootballFixture readFixture(ResultSet rs) throws SQLException {
        return new FootballFixture(
            rs.getLong("id"),
            rs.getString("home_team"),
            rs.getString("away_team"),
            rs.getString("competition"),
            rs.getString("fixture_date"),
            rs.getString("fixture_time"),
            rs.getString("venue"),
            List.of()
        );
    }

    @Override
    public synchronized void close() {
        if (connection != null) {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("Failed to close fixtures database connection", e);
            }
            connection = null;
        }
    }

    private Connection getConnection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            String url = "jdbc:sqlite:" + dbPath.toAbsolutePath();
            Properties props = new Properties();
            props.setProperty("open_mode", "1"); // SQLITE_OPEN_READONLY
            connection = DriverManager.getConnection(url, props);
        }
        return connection;
    }
}
