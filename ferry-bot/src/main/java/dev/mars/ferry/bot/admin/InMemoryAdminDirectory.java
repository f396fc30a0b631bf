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

package dev.mars.ferry.bot.admin;

import dev.mars.ferry.config.FerryConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * {@link AdminDirectory} held in memory.
 *
 * <p>Permanent admins come from configuration and can never be removed. Extra admins from the
 * configuration or the {@code EXTRA_ADMINS} environment variable are admins too but are not
 * managed here. Dynamic admins are added and removed at runtime.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InMemoryAdminDirectory implements AdminDirectory {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryAdminDirectory.class);

    public static final String EXTRA_ADMINS_ENV = "EXTRA_ADMINS";

    private final Set<String> permanentAdmins;
    private final Set<String> extraAdmins;
    private final Set<String> dynamicAdmins = ConcurrentHashMap.newKeySet();

    public InMemoryAdminDirectory(Collection<String> permanentAdmins, Collection<String> extraAdmins) {
        this.permanentAdmins = normalizeAll(permanentAdmins);
        this.extraAdmins = normalizeAll(extraAdmins);
        logger.info("Admin directory initialized: {} permanent, {} extra",
                this.permanentAdmins.size(), this.extraAdmins.size());
    }

    /**
     * Seed from {@code ferry.admin.permanent}, {@code ferry.admin.extra} and the
     * {@code EXTRA_ADMINS} environment variable.
     */
    public static InMemoryAdminDirectory fromConfiguration(FerryConfiguration config) {
        Set<String> extra = new HashSet<>(config.getExtraAdmins());
        String env = System.getenv(EXTRA_ADMINS_ENV);
        if (env != null && !env.isBlank()) {
            Arrays.stream(env.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(extra::add);
        }
        return new InMemoryAdminDirectory(config.getPermanentAdmins(), extra);
    }

    /**
     * Prefix {@code @} unless the handle already has it or is a numeric user id.
     *
     * @return the normalized handle, or null for a null or blank handle
     */
    public static String normalize(String handle) {
        if (handle == null || handle.isBlank()) {
            return null;
        }
        String trimmed = handle.trim();
        if (trimmed.startsWith("@") || trimmed.chars().allMatch(Character::isDigit)) {
            return trimmed;
        }
        return "@" + trimmed;
    }

    @Override
    public boolean isAdmin(String handle) {
        String normalized = normalize(handle);
        if (normalized == null) {
            return false;
        }
        return permanentAdmins.contains(normalized)
                || extraAdmins.contains(normalized)
                || dynamicAdmins.contains(normalized);
    }

    @Override
    public AdminChange addAdmin(String handle) {
        String normalized = Objects.requireNonNull(normalize(handle), "Handle cannot be blank");
        if (permanentAdmins.contains(normalized)) {
            return AdminChange.refused("User is already a permanent admin.");
        }
        if (!dynamicAdmins.add(normalized)) {
            return AdminChange.refused("User is already an admin.");
        }
        logger.info("Added admin {}", normalized);
        return AdminChange.applied("User " + normalized + " added as admin.");
    }

    @Override
    public AdminChange removeAdmin(String handle) {
        String normalized = Objects.requireNonNull(normalize(handle), "Handle cannot be blank");
        if (permanentAdmins.contains(normalized)) {
            return AdminChange.refused("Cannot remove permanent admins.");
        }
        if (!dynamicAdmins.remove(normalized)) {
            return AdminChange.refused("User is not a dynamic admin.");
        }
        logger.info("Removed admin {}", normalized);
        return AdminChange.applied("User " + normalized + " removed from admins.");
    }

    @Override
    public Set<String> getAllAdmins() {
        Set<String> all = new HashSet<>(permanentAdmins);
        all.addAll(extraAdmins);
        all.addAll(dynamicAdmins);
        return Collections.unmodifiableSet(all);
    }

    private static Set<String> normalizeAll(Collection<String> handles) {
        if (handles == null) {
            return Set.of();
        }
        return handles.stream()
                .map(InMemoryAdminDirectory::normalize)
                .filter(Objects::nonNull)
                .collect(Collectors.toUnmodifiableSet());
    }
}
