package com.tennis.tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tennis.tracker")
public class TrackerProperties {

    /**
     * Preset used when a start request names no format.
     */
    private String defaultFormat = "FULL_SETS";

    private final Export export = new Export();

    public String getDefaultFormat() {
        return defaultFormat;
    }

    public void setDefaultFormat(String defaultFormat) {
        this.defaultFormat = defaultFormat;
    }

    public Export getExport() {
        return export;
    }

    public static class Export {

        /**
         * Timestamp appended to export file names.
         */
        private String timestampPattern = "yyyy-MM-dd_HH-mm-ss";

        public String getTimestampPattern() {
            return timestampPattern;
        }

        public void setTimestampPattern(String timestampPattern) {
            this.timestampPattern = timestampPattern;
        }
    }
}
