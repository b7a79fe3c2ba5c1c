module com.couchtv.sources {
    // Exports
    exports com.couchtv.sources.http;
    exports com.couchtv.sources.tmdb;
    exports com.couchtv.sources.tvmaze;
    exports com.couchtv.sources.xtream;
    exports com.couchtv.sources.football;
    exports com.couchtv.sources.image;

    // Java modules
    requires java.desktop;  // ImageIO for posters
    requires java.sql;

    // Internal modules
    requires transitive com.couchtv.core;

    // Jackson
    requires com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.annotation;

    // HTTP & parsing
    requires okhttp3;
    requires org.jsoup;

    // SQLite
    requires org.xerial.sqlitejdbc;

    // Logging
    requires org.slf4j;

    // Jackson reflection access
    opens com.couchtv.sources.tmdb to com.fasterxml.jackson.databind;
    opens com.couchtv.sources.tvmaze to com.fasterxml.jackson.databind;
}
