module com.couchtv.core {
    // Exports
    exports com.couchtv.core.cache;
    exports com.couchtv.core.epg;

    // Logging
    requires org.slf4j;
}
