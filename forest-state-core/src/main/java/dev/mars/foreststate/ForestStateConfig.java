/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.foreststate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * Configuration for the Forest state layer.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dforest.dataDir=/path})</li>
 *   <li>Environment variables (e.g., {@code FOREST_DATA_DIR})</li>
 *   <li>Properties file ({@code forest-state.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>dataDir</td><td>forest.dataDir</td><td>FOREST_DATA_DIR</td><td>~/.forest-data</td></tr>
 *   <tr><td>syncEnabled</td><td>forest.syncEnabled</td><td>FOREST_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>verifyWrites</td><td>forest.verifyWrites</td><td>FOREST_VERIFY_WRITES</td><td>false</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>forest.minFreeSpaceMb</td><td>FOREST_MIN_FREE_SPACE_MB</td><td>64</td></tr>
 *   <tr><td>maxDocumentSizeMb</td><td>forest.maxDocumentSizeMb</td><td>FOREST_MAX_DOCUMENT_SIZE_MB</td><td>16</td></tr>
 *   <tr><td>ioThreads</td><td>forest.ioThreads</td><td>FOREST_IO_THREADS</td><td>4</td></tr>
 *   <tr><td>sessionDbFile</td><td>forest.sessionDbFile</td><td>FOREST_SESSION_DB_FILE</td><td>dialogues.db</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # forest-state.properties
 * forest.dataDir=/var/lib/forest
 * forest.syncEnabled=true
 * forest.verifyWrites=false
 * forest.ioThreads=8
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * ForestStateConfig config = ForestStateConfig.builder()
 *     .dataDir(Path.of("/var/lib/forest"))
 *     .verifyWrites(true)
 *     .build();
 *
 * try (ForestState state = ForestState.open(config)) {
 *     ...
 * }
 * </pre>
 */
public final class ForestStateConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ForestStateConfig.class);

    private static final String PROPERTIES_FILE = "forest-state.properties";

    // Property keys
    private static final String PROP_DATA_DIR = "forest.dataDir";
    private static final String PROP_SYNC_ENABLED = "forest.syncEnabled";
    private static final String PROP_VERIFY_WRITES = "forest.verifyWrites";
    private static final String PROP_MIN_FREE_SPACE_MB = "forest.minFreeSpaceMb";
    private static final String PROP_MAX_DOCUMENT_SIZE_MB = "forest.maxDocumentSizeMb";
    private static final String PROP_IO_THREADS = "forest.ioThreads";
    private static final String PROP_SESSION_DB_FILE = "forest.sessionDbFile";

    // Environment variable keys
    private static final String ENV_DATA_DIR = "FOREST_DATA_DIR";
    private static final String ENV_SYNC_ENABLED = "FOREST_SYNC_ENABLED";
    private static final String ENV_VERIFY_WRITES = "FOREST_VERIFY_WRITES";
    private static final String ENV_MIN_FREE_SPACE_MB = "FOREST_MIN_FREE_SPACE_MB";
    private static final String ENV_MAX_DOCUMENT_SIZE_MB = "FOREST_MAX_DOCUMENT_SIZE_MB";
    private static final String ENV_IO_THREADS = "FOREST_IO_THREADS";
    private static final String ENV_SESSION_DB_FILE = "FOREST_SESSION_DB_FILE";

    // Defaults
    private static final Path DEFAULT_DATA_DIR = Path.of(System.getProperty("user.home"), ".forest-data");
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final boolean DEFAULT_VERIFY_WRITES = false;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 64;
    private static final int DEFAULT_MAX_DOCUMENT_SIZE_MB = 16;
    private static final int DEFAULT_IO_THREADS = 4;
    private static final String DEFAULT_SESSION_DB_FILE = "dialogues.db";

    // Keeps maxDocumentSizeBytes() within int range
    private static final int MAX_DOCUMENT_SIZE_MB = 1024;
    private static final Pattern DB_FILE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    private final Path dataDir;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final int minFreeSpaceMb;
    private final int maxDocumentSizeMb;
    private final int ioThreads;
    private final String sessionDbFile;

    private ForestStateConfig(Builder builder) {
        this.dataDir = builder.dataDir;
        this.syncEnabled = builder.syncEnabled;
        this.verifyWrites = builder.verifyWrites;
        this.minFreeSpaceMb = builder.minFreeSpaceMb;
        this.maxDocumentSizeMb = builder.maxDocumentSizeMb;
        this.ioThreads = builder.ioThreads;
        this.sessionDbFile = builder.sessionDbFile;
    }

    /** Root data directory; one subdirectory per project lives beneath it. */
    public Path dataDir() {
        return dataDir;
    }

    /** Whether fsync is enabled (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Whether to verify writes by reading the committed file back. */
    public boolean verifyWrites() {
        return verifyWrites;
    }

    /** Minimum free disk space in MB required before writes. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Maximum encoded document size in MB. */
    public int maxDocumentSizeMb() {
        return maxDocumentSizeMb;
    }

    /** Size of the file I/O thread pool. */
    public int ioThreads() {
        return ioThreads;
    }

    /** File name of the embedded session database, relative to {@link #dataDir()}. */
    public String sessionDbFile() {
        return sessionDbFile;
    }

    /** Absolute location of the session database. */
    public Path sessionDbPath() {
        return dataDir.resolve(sessionDbFile);
    }

    /** Minimum free disk space in bytes. */
    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    /** Maximum document size in bytes. */
    public int maxDocumentSizeBytes() {
        return maxDocumentSizeMb * 1024 * 1024;
    }

    @Override
    public String toString() {
        return "ForestStateConfig{" +
                "dataDir=" + dataDir +
                ", syncEnabled=" + syncEnabled +
                ", verifyWrites=" + verifyWrites +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
                ", maxDocumentSizeMb=" + maxDocumentSizeMb +
                ", ioThreads=" + ioThreads +
                ", sessionDbFile=" + sessionDbFile +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code ForestStateConfig.builder().build()}.
     */
    public static ForestStateConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link ForestStateConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path dataDir;
        private Boolean syncEnabled;
        private Boolean verifyWrites;
        private Integer minFreeSpaceMb;
        private Integer maxDocumentSizeMb;
        private Integer ioThreads;
        private String sessionDbFile;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the data directory. */
        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /** Sets the data directory from a string path. */
        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Enables or disables read-after-write verification (default: false). */
        public Builder verifyWrites(boolean verifyWrites) {
            this.verifyWrites = verifyWrites;
            return this;
        }

        /** Sets minimum free disk space in MB (default: 64). */
        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        /** Sets maximum document size in MB (default: 16). */
        public Builder maxDocumentSizeMb(int maxDocumentSizeMb) {
            this.maxDocumentSizeMb = maxDocumentSizeMb;
            return this;
        }

        /** Sets the file I/O pool size (default: 4). */
        public Builder ioThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        /** Sets the session database file name (default: dialogues.db). */
        public Builder sessionDbFile(String sessionDbFile) {
            this.sessionDbFile = sessionDbFile;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if a resolved numeric value is out of range
         */
        public ForestStateConfig build() {
            if (dataDir == null) {
                dataDir = Path.of(resolve(PROP_DATA_DIR, ENV_DATA_DIR, DEFAULT_DATA_DIR.toString()));
            }
            if (syncEnabled == null) {
                syncEnabled = Boolean.parseBoolean(
                        resolve(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, String.valueOf(DEFAULT_SYNC_ENABLED)));
            }
            if (verifyWrites == null) {
                verifyWrites = Boolean.parseBoolean(
                        resolve(PROP_VERIFY_WRITES, ENV_VERIFY_WRITES, String.valueOf(DEFAULT_VERIFY_WRITES)));
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = resolveInt(PROP_MIN_FREE_SPACE_MB, ENV_MIN_FREE_SPACE_MB, DEFAULT_MIN_FREE_SPACE_MB);
            }
            if (maxDocumentSizeMb == null) {
                maxDocumentSizeMb = resolveInt(PROP_MAX_DOCUMENT_SIZE_MB, ENV_MAX_DOCUMENT_SIZE_MB,
                        DEFAULT_MAX_DOCUMENT_SIZE_MB);
            }
            if (ioThreads == null) {
                ioThreads = resolveInt(PROP_IO_THREADS, ENV_IO_THREADS, DEFAULT_IO_THREADS);
            }
            if (sessionDbFile == null) {
                sessionDbFile = resolve(PROP_SESSION_DB_FILE, ENV_SESSION_DB_FILE, DEFAULT_SESSION_DB_FILE);
            }

            if (minFreeSpaceMb < 0) {
                throw new IllegalArgumentException("minFreeSpaceMb must not be negative: " + minFreeSpaceMb);
            }
            if (maxDocumentSizeMb <= 0 || maxDocumentSizeMb > MAX_DOCUMENT_SIZE_MB) {
                throw new IllegalArgumentException("maxDocumentSizeMb must be within [1, " + MAX_DOCUMENT_SIZE_MB +
                        "]: " + maxDocumentSizeMb);
            }
            if (ioThreads <= 0) {
                throw new IllegalArgumentException("ioThreads must be positive: " + ioThreads);
            }
            // The database sits beside the project directories, never inside one
            if (!DB_FILE_NAME.matcher(sessionDbFile).matches() || sessionDbFile.endsWith(".tmp")) {
                throw new IllegalArgumentException("sessionDbFile must be a plain file name: " + sessionDbFile);
            }

            return new ForestStateConfig(this);
        }

        private String resolve(String sysProp, String envVar, String defaultValue) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 4. Default
            return defaultValue;
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            String value = resolve(sysProp, envVar, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring non-numeric value '{}' for {}, using default {}", value, sysProp, defaultValue);
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = ForestStateConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read classpath {}: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
