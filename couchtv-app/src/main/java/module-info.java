module com.couchtv.app {
    // Exports
    exports com.couchtv.app.config;
    exports com.couchtv.app.session;
    exports com.couchtv.app.ui;

    // Java modules
    requires java.desktop;

    // Internal modules
    requires com.couchtv.sources;

    // Jackson (YAML config)
    requires com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.dataformat.yaml;
    requires com.fasterxml.jackson.annotation;

    // Logging
    requires org.slf4j;

    // Jackson reflection access
    opens com.couchtv.app.config to com.fasterxml.jackson.databind;
}
