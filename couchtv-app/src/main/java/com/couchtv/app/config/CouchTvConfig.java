package com.couchtv.app.config;

import com.couchtv.core.cache.CachePolicy;
import com.couchtv.sources.xtream.XtreamCredentials;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Settings for CouchTV.
 * Stored in ~/.couchtv/config.yaml
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CouchTvConfig {

    private static final Logger log = LoggerFactory.getLogger(CouchTvConfig.class);

    public static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".couchtv", "config.yaml"
    );
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    // Credentials
    private String tmdbApiKey = "";
    private String xtreamServer = "";
    private String xtreamUsername = "";
    private String xtreamPassword = "";

    // Football
    static final String DEFAULT_FIXTURES_DB = Path.of("Soccer-Scraper-main", "output", "fixtures.db").toString();
    private String fixturesDbPath = DEFAULT_FIXTURES_DB;

    // Cache policies, one per source
    private static final SourcePolicy TMDB_DEFAULT = new SourcePolicy(300, 30);
    private static final SourcePolicy TVMAZE_DEFAULT = new SourcePolicy(600, 30);
    private static final SourcePolicy EPG_DEFAULT = new SourcePolicy(30, 30);
    private static final SourcePolicy FOOTBALL_DEFAULT = new SourcePolicy(300, 30);
    private static final SourcePolicy IMAGES_DEFAULT = new SourcePolicy(1800, 30);

    private SourcePolicy tmdb = TMDB_DEFAULT.copy();
    private SourcePolicy tvmaze = TVMAZE_DEFAULT.copy();
    private SourcePolicy epg = EPG_DEFAULT.copy();
    private SourcePolicy football = FOOTBALL_DEFAULT.copy();
    private SourcePolicy images = IMAGES_DEFAULT.copy();

    // Result pump
    private int frameIntervalMillis = 500;

    public CouchTvConfig() {
        // Default constructor for YAML
    }

    /**
     * TTL and cooldown for one source's cache.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SourcePolicy {
        // Marks a field the YAML left out
        private static final long UNSET = Long.MIN_VALUE;

        private long ttlSeconds = UNSET;
        private long cooldownSeconds = UNSET;

        public SourcePolicy() {
            // Default constructor for YAML
        }

        public SourcePolicy(long ttlSeconds, long cooldownSeconds) {
            this.ttlSeconds = ttlSeconds;
            this.cooldownSeconds = cooldownSeconds;
        }

        public long getTtlSeconds() {
            return ttlSeconds;
        }

        public void setTtlSeconds(long ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
        }

        public long getCooldownSeconds() {
            return cooldownSeconds;
        }

        public void setCooldownSeconds(long cooldownSeconds) {
            this.cooldownSeconds = cooldownSeconds;
        }

        SourcePolicy copy() {
            return new SourcePolicy(ttlSeconds, cooldownSeconds);
        }

        public CachePolicy toCachePolicy() {
            return CachePolicy.ofSeconds(ttlSeconds, cooldownSeconds);
        }
    }

    /**
     * Copy of {@code policy} with missing or negative durations replaced by the source default.
     */
    private static SourcePolicy sanitized(SourcePolicy policy, SourcePolicy fallback, String source) {
        if (policy == null) {
            return fallback.copy();
        }
        long ttl = policy.getTtlSeconds();
        long cooldown = policy.getCooldownSeconds();
        if (ttl == SourcePolicy.UNSET) {
            ttl = fallback.getTtlSeconds();
        } else if (ttl < 0) {
            log.warn("Negative ttlSeconds {} for {}, using default {}", ttl, source, fallback.getTtlSeconds());
            ttl = fallback.getTtlSeconds();
        }
        if (cooldown == SourcePolicy.UNSET) {
            cooldown = fallback.getCooldownSeconds();
        } else if (cooldown < 0) {
            log.warn("Negative cooldownSeconds {} for {}, using default {}",
                cooldown, source, fallback.getCooldownSeconds());
            cooldown = fallback.getCooldownSeconds();
        }
        return new SourcePolicy(ttl, cooldown);
    }

    // ==================== Credentials ====================

    public String getTmdbApiKey() {
        return tmdbApiKey;
    }

    public void setTmdbApiKey(String tmdbApiKey) {
        this.tmdbApiKey = tmdbApiKey != null ? tmdbApiKey.trim() : "";
    }

    public String getXtreamServer() {
        return xtreamServer;
    }

    public void setXtreamServer(String xtreamServer) {
        this.xtreamServer = xtreamServer != null ? xtreamServer : "";
    }

    public String getXtreamUsername() {
        return xtreamUsername;
    }

    public void setXtreamUsername(String xtreamUsername) {
        this.xtreamUsername = xtreamUsername != null ? xtreamUsername : "";
    }

    public String getXtreamPassword() {
        return xtreamPassword;
    }

    public void setXtreamPassword(String xtreamPassword) {
        this.xtreamPassword = xtreamPassword != null ? xtreamPassword : "";
    }

    @JsonIgnore
    public XtreamCredentials getXtreamCredentials() {
        return new XtreamCredentials(xtreamServer, xtreamUsername, xtreamPassword);
    }

    @JsonIgnore
    public void setXtreamCredentials(XtreamCredentials credentials) {
        setXtreamServer(credentials.serverUrl());
        setXtreamUsername(credentials.username());
        setXtreamPassword(credentials.password());
    }

    // ==================== Football ====================

    public String getFixturesDbPath() {
        return fixturesDbPath;
    }

    public void setFixturesDbPath(String fixturesDbPath) {
        this.fixturesDbPath = fixturesDbPath != null && !fixturesDbPath.isBlank()
            ? fixturesDbPath.trim() : DEFAULT_FIXTURES_DB;
    }

    // ==================== Cache Policies ====================

    public SourcePolicy getTmdb() {
        return tmdb;
    }

    public void setTmdb(SourcePolicy tmdb) {
        this.tmdb = sanitized(tmdb, TMDB_DEFAULT, "tmdb");
    }

    public SourcePolicy getTvmaze() {
        return tvmaze;
    }

    public void setTvmaze(SourcePolicy tvmaze) {
        this.tvmaze = sanitized(tvmaze, TVMAZE_DEFAULT, "tvmaze");
    }

    public SourcePolicy getEpg() {
        return epg;
    }

    public void setEpg(SourcePolicy epg) {
        this.epg = sanitized(epg, EPG_DEFAULT, "epg");
    }

    public SourcePolicy getFootball() {
        return football;
    }

    public void setFootball(SourcePolicy football) {
        this.football = sanitized(football, FOOTBALL_DEFAULT, "football");
    }

    public SourcePolicy getImages() {
        return images;
    }

    public void setImages(SourcePolicy images) {
        this.images = sanitized(images, IMAGES_DEFAULT, "images");
    }

    public int getFrameIntervalMillis() {
        return frameIntervalMillis;
    }

    public void setFrameIntervalMillis(int frameIntervalMillis) {
        this.frameIntervalMillis = frameIntervalMillis;
    }

    // ==================== Persistence ====================

    public void save() throws IOException {
        save(DEFAULT_PATH);
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        YAML.writeValue(path.toFile(), this);
    }

    public static CouchTvConfig load() {
        return load(DEFAULT_PATH);
    }

    /**
     * Read the config, or defaults when the file is missing or unreadable.
     */
    public static CouchTvConfig load(Path path) {
        if (Files.exists(path)) {
            try {
                CouchTvConfig config = YAML.readValue(path.toFile(), CouchTvConfig.class);
                if (config != null) {
                    return config;
                }
            } catch (IOException e) {
                log.warn("Failed to load config from {}: {}", path, e.getMessage());
            }
        }
        return new CouchTvConfig();
    }
}
