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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for FerryConfiguration.
 * Validates defaults, overrides, type conversion and list parsing.
 */
class FerryConfigurationTest {

    private FerryConfiguration config;

    @BeforeEach
    void setUp() {
        config = new FerryConfiguration(new Properties());
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(FerryConfiguration.PROGRESS_THROTTLE_MS);
    }

    // ========== Default Configuration Tests ==========

    @Test
    void testDefaultProgressThrottle() {
        assertEquals(2000, config.getProgressThrottleMs());
    }

    @Test
    void testDefaultWorkerSettings() {
        assertEquals("ferry-transfer", config.getWorkerPoolName());
        assertEquals(3_600_000L, config.getWorkerMaxExecuteTimeMs());
    }

    @Test
    void testDefaultRemediationHint() {
        assertEquals("Use /reauth to fix this.", config.getAuthRemediationHint());
    }

    @Test
    void testDefaultAdminsAreEmpty() {
        assertTrue(config.getPermanentAdmins().isEmpty());
        assertTrue(config.getExtraAdmins().isEmpty());
        assertEquals("", config.getTransferDestination());
    }

    // ========== Override Tests ==========

    @Test
    void testPropertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty(FerryConfiguration.PROGRESS_THROTTLE_MS, "500");
        props.setProperty(FerryConfiguration.TRANSFER_DESTINATION, "folder-9");

        FerryConfiguration custom = new FerryConfiguration(props);

        assertEquals(500, custom.getProgressThrottleMs());
        assertEquals("folder-9", custom.getTransferDestination());
    }

    @Test
    void testInvalidNumberFallsBackToDefault() {
        config.setProperty(FerryConfiguration.PROGRESS_THROTTLE_MS, "soon");
        assertEquals(2000, config.getProgressThrottleMs());
    }

    @Test
    void testAdminListsAreTrimmed() {
        config.setProperty(FerryConfiguration.ADMIN_PERMANENT, " @owner , 12345,,");
        config.setProperty(FerryConfiguration.ADMIN_EXTRA, "@helper");

        assertEquals(List.of("@owner", "12345"), config.getPermanentAdmins());
        assertEquals(List.of("@helper"), config.getExtraAdmins());
    }

    @Test
    void testSystemPropertyOverride() {
        System.setProperty(FerryConfiguration.PROGRESS_THROTTLE_MS, "750");
        assertEquals(750, new FerryConfiguration().getProgressThrottleMs());
    }

    @Test
    void testGenericPropertyAccess() {
        assertNull(config.getProperty("ferry.unknown"));
        assertEquals("fallback", config.getProperty("ferry.unknown", "fallback"));
    }
}
