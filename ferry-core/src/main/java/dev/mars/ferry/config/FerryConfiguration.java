/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.ferry.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Configuration management for Ferry.
 * Defaults are overlaid by the first {@code ferry.properties} found and then by
 * {@code ferry.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FerryConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(FerryConfiguration.class);

    public static final String PROGRESS_THROTTLE_MS = "ferry.progress.throttle.ms";
    public static final String WORKER_POOL_NAME = "ferry.worker.pool.name";
    public static final String WORKER_MAX_EXECUTE_TIME_MS = "ferry.worker.max.execute.time.ms";
    public static final String TRANSFER_DESTINATION = "ferry.transfer.destination";
    public static final String AUTH_REMEDIATION_HINT = "ferry.auth.remediation.hint";
    public static final String ADMIN_PERMANENT = "ferry.admin.permanent";
    public static final String ADMIN_EXTRA = "ferry.admin.extra";

    // Default configuration values
    private static final long DEFAULT_PROGRESS_THROTTLE_MS = 2000;
    private static final String DEFAULT_WORKER_POOL_NAME = "ferry-transfer";
    private static final long DEFAULT_WORKER_MAX_EXECUTE_TIME_MS = 3_600_000; // 1 hour
    private static final String DEFAULT_TRANSFER_DESTINATION = "";
    private static final String DEFAULT_AUTH_REMEDIATION_HINT = "Use /reauth to fix this.";

    private final Properties properties;

    public FerryConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public FerryConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Worker Configuration
    public long getProgressThrottleMs() {
        return getLongProperty(PROGRESS_THROTTLE_MS, DEFAULT_PROGRESS_THROTTLE_MS);
    }

    public String getWorkerPoolName() {
        return getStringProperty(WORKER_POOL_NAME, DEFAULT_WORKER_POOL_NAME);
    }

    public long getWorkerMaxExecuteTimeMs() {
        return getLongProperty(WORKER_MAX_EXECUTE_TIME_MS, DEFAULT_WORKER_MAX_EXECUTE_TIME_MS);
    }

    // Transfer Configuration
    public String getTransferDestination() {
        return getStringProperty(TRANSFER_DESTINATION, DEFAULT_TRANSFER_DESTINATION);
    }

    public String getAuthRemediationHint() {
        return getStringProperty(AUTH_REMEDIATION_HINT, DEFAULT_AUTH_REMEDIATION_HINT);
    }

    // Administration
    public List<String> getPermanentAdmins() {
        return getListProperty(ADMIN_PERMANENT);
    }

    public List<String> getExtraAdmins() {
        return getListProperty(ADMIN_EXTRA);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    // Utility methods for type conversion
    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private List<String> getListProperty(String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return Collections.emptyList();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(PROGRESS_THROTTLE_MS, String.valueOf(DEFAULT_PROGRESS_THROTTLE_MS));
        properties.setProperty(WORKER_POOL_NAME, DEFAULT_WORKER_POOL_NAME);
        properties.setProperty(WORKER_MAX_EXECUTE_TIME_MS, String.valueOf(DEFAULT_WORKER_MAX_EXECUTE_TIME_MS));
        properties.setProperty(TRANSFER_DESTINATION, DEFAULT_TRANSFER_DESTINATION);
        properties.setProperty(AUTH_REMEDIATION_HINT, DEFAULT_AUTH_REMEDIATION_HINT);
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "ferry.properties",
                "config/ferry.properties",
                System.getProperty("user.home") + "/.ferry/ferry.properties",
                "/etc/ferry/ferry.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("ferry.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("ferry."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "FerryConfiguration{" +
                "progressThrottleMs=" + getProgressThrottleMs() +
                ", workerPoolName='" + getWorkerPoolName() + '\'' +
                ", transferDestination='" + getTransferDestination() + '\'' +
                '}';
    }
}
