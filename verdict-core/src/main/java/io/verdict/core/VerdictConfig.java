package io.verdict.core;

import java.time.Duration;

/// Configuration options for the Verdict review engine.
///
/// Controls merge timing, merge thread pool sizing, write retries and storage backend
/// selection. Use the {@link Builder} for fluent configuration or construct directly
/// with setters for mutable configuration.
///
/// ### Default Values
/// - `mergeTimeout`: 5 minutes
/// - `mergeThreadPoolSize`: `4`
/// - `maxAppendAttempts`: `5`
/// - `storageType`: `"memory"`
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended to be
/// configured before passing to {@link VerdictFactory}. Do not modify after environment
/// creation.
///
/// @see VerdictFactory#createEnvironment(VerdictConfig)
public class VerdictConfig {
    private Duration mergeTimeout = Duration.ofMinutes(5);
    private int mergeThreadPoolSize = 4;
    private int maxAppendAttempts = 5;
    private String storageType = "memory";

    /// Creates a configuration with default values.
    public VerdictConfig() {}

    /// Returns how long the merge coordinator waits for the workspace system to merge.
    ///
    /// @return the timeout, never null
    public Duration getMergeTimeout() {
        return mergeTimeout;
    }

    /// Sets the merge timeout.
    ///
    /// ### Contracts
    /// - **Precondition**: `mergeTimeout` must be positive
    ///
    /// @param mergeTimeout the timeout, not null
    public void setMergeTimeout(Duration mergeTimeout) {
        this.mergeTimeout = mergeTimeout;
    }

    /// Returns the number of threads available for concurrent merges of different sessions.
    public int getMergeThreadPoolSize() {
        return mergeThreadPoolSize;
    }

    public void setMergeThreadPoolSize(int mergeThreadPoolSize) {
        this.mergeThreadPoolSize = mergeThreadPoolSize;
    }

    /// Returns how many optimistic write attempts the session store makes before giving up.
    public int getMaxAppendAttempts() {
        return maxAppendAttempts;
    }

    public void setMaxAppendAttempts(int maxAppendAttempts) {
        this.maxAppendAttempts = maxAppendAttempts;
    }

    /// Returns the storage backend identifier.
    ///
    /// @return `"memory"` or `"jdbc"`, never null
    public String getStorageType() {
        return storageType;
    }

    public void setStorageType(String storageType) {
        this.storageType = storageType;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link VerdictConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final VerdictConfig config = new VerdictConfig();

        public Builder mergeTimeout(Duration mergeTimeout) {
            config.mergeTimeout = mergeTimeout;
            return this;
        }

        public Builder mergeThreadPoolSize(int mergeThreadPoolSize) {
            config.mergeThreadPoolSize = mergeThreadPoolSize;
            return this;
        }

        public Builder maxAppendAttempts(int maxAppendAttempts) {
            config.maxAppendAttempts = maxAppendAttempts;
            return this;
        }

        public Builder storageType(String storageType) {
            config.storageType = storageType;
            return this;
        }

        /// Builds and returns the configured {@link VerdictConfig} instance.
        ///
        /// @return the configured instance, never null
        public VerdictConfig build() {
            return config;
        }
    }
}
