package com.ganesh.doctable;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;

import java.time.Clock;
import java.time.Duration;

/**
 * Holds the configuration for a {@link DocumentTableStore} instance.
 * Use the nested {@link Builder} class to construct a configuration object.
 */
public class Config {
    private final String dataDirectory;
    private final String fileExtension;
    private final String metadataFileName;
    private final Duration cacheTtl;
    private final long cacheMaximumSize;
    private final Ticker ticker;
    private final Clock clock;
    private final boolean prettyPrint;

    private Config(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.fileExtension = builder.fileExtension;
        this.metadataFileName = builder.metadataFileName;
        this.cacheTtl = builder.cacheTtl;
        this.cacheMaximumSize = builder.cacheMaximumSize;
        this.ticker = builder.ticker;
        this.clock = builder.clock;
        this.prettyPrint = builder.prettyPrint;
    }

    public String getDataDirectory() { return dataDirectory; }
    public String getFileExtension() { return fileExtension; }
    public String getMetadataFileName() { return metadataFileName; }
    public Duration getCacheTtl() { return cacheTtl; }
    public long getCacheMaximumSize() { return cacheMaximumSize; }
    public Ticker getTicker() { return ticker; }
    public Clock getClock() { return clock; }
    public boolean isPrettyPrint() { return prettyPrint; }

    /**
     * A builder for creating immutable {@link Config} instances.
     * Provides default values for all configuration parameters.
     */
    public static class Builder {
        private String dataDirectory = "data/";
        private String fileExtension = ".json";
        private String metadataFileName = ".table_info";
        private Duration cacheTtl = Duration.ofSeconds(300); // 5 minutes
        private long cacheMaximumSize = 10_000;
        private Ticker ticker = Ticker.systemTicker();
        private Clock clock = Clock.systemUTC();
        private boolean prettyPrint = false;

        /**
         * Sets the directory holding the table files and the metadata file.
         * @param dataDirectory The path to the data directory.
         * @return This builder instance for chaining.
         */
        public Builder withDataDirectory(String dataDirectory) {
            this.dataDirectory = dataDirectory;
            return this;
        }

        /**
         * Sets the extension appended to a table name to form its backing file name.
         * @param fileExtension The extension, including the leading dot.
         * @return This builder instance for chaining.
         */
        public Builder withFileExtension(String fileExtension) {
            this.fileExtension = fileExtension;
            return this;
        }

        public Builder withMetadataFileName(String metadataFileName) {
            this.metadataFileName = metadataFileName;
            return this;
        }

        /**
         * Sets how long a value read or written through a KV table stays in that table's read cache.
         * @param cacheTtl A positive duration.
         * @return This builder instance for chaining.
         */
        public Builder withCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder withCacheMaximumSize(long cacheMaximumSize) {
            this.cacheMaximumSize = cacheMaximumSize;
            return this;
        }

        /**
         * Sets the time source used for cache expiry. Tests substitute a fake ticker.
         * @param ticker The ticker.
         * @return This builder instance for chaining.
         */
        public Builder withTicker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        /**
         * Sets the wall clock used for {@code created_at}/{@code updated_at} timestamps.
         * @param clock The clock.
         * @return This builder instance for chaining.
         */
        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withPrettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
            return this;
        }

        /**
         * Builds the final, immutable {@link Config} object.
         * @return A new Config instance.
         */
        public Config build() {
            Preconditions.checkNotNull(dataDirectory, "dataDirectory");
            Preconditions.checkArgument(fileExtension != null && fileExtension.startsWith("."),
                    "fileExtension must start with a dot: %s", fileExtension);
            Preconditions.checkArgument(metadataFileName != null && !metadataFileName.isEmpty(),
                    "metadataFileName must not be empty");
            Preconditions.checkArgument(!isTableFileName(metadataFileName, fileExtension),
                    "metadataFileName collides with the file of a table: %s", metadataFileName);
            Preconditions.checkArgument(cacheTtl != null && !cacheTtl.isNegative() && !cacheTtl.isZero(),
                    "cacheTtl must be positive: %s", cacheTtl);
            Preconditions.checkArgument(cacheMaximumSize > 0, "cacheMaximumSize must be positive");
            Preconditions.checkNotNull(ticker, "ticker");
            Preconditions.checkNotNull(clock, "clock");
            return new Config(this);
        }

        private static boolean isTableFileName(String fileName, String extension) {
            if (!fileName.endsWith(extension)) {
                return false;
            }
            String stem = fileName.substring(0, fileName.length() - extension.length());
            return DocumentTableStore.TABLE_NAME_PATTERN.matcher(stem).matches();
        }
    }
}
