package me.golemcore.planner.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.planner.domain.exception.InvalidArgumentException;
import me.golemcore.planner.domain.exception.StorageException;
import me.golemcore.planner.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Role-based command restrictions, stored in {@code roles/permissions.json} as
 * role id to allowed command names.
 *
 * <p>
 * A command that no role lists is open to everyone. Once any role lists it,
 * only members of a listing role and administrators may run it.
 */
@Service
@Slf4j
public class CommandPermissionService {

    private static final String ROLES_DIR = "roles";
    private static final String PERMISSIONS_FILE = "permissions.json";
    private static final TypeReference<TreeMap<String, TreeSet<String>>> PERMISSIONS_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private TreeMap<String, TreeSet<String>> permissions;

    public CommandPermissionService(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    public synchronized boolean isAllowed(String command, Collection<String> roleIds, boolean admin) {
        if (admin) {
            return true;
        }
        String normalized = normalizeCommand(command);
        boolean restricted = false;
        for (Map.Entry<String, TreeSet<String>> entry : loaded().entrySet()) {
            if (entry.getValue().contains(normalized)) {
                restricted = true;
                if (roleIds != null && roleIds.contains(entry.getKey())) {
                    return true;
                }
            }
        }
        return !restricted;
    }

    /**
     * @return false if the role already had the command
     */
    public synchronized boolean grant(String roleId, String command) {
        String role = requireRole(roleId);
        String normalized = requireCommand(command);
        if (loaded().getOrDefault(role, new TreeSet<>()).contains(normalized)) {
            return false;
        }
        mutate(current -> current.computeIfAbsent(role, key -> new TreeSet<>()).add(normalized));
        log.info("[Permissions] Granted /{} to role {}", normalized, role);
        return true;
    }

    /**
     * @return false if the role did not have the command
     */
    public synchronized boolean revoke(String roleId, String command) {
        String role = requireRole(roleId);
        String normalized = requireCommand(command);
        TreeSet<String> granted = loaded().get(role);
        if (granted == null || !granted.contains(normalized)) {
            return false;
        }
        mutate(current -> {
            TreeSet<String> commands = current.get(role);
            commands.remove(normalized);
            if (commands.isEmpty()) {
                current.remove(role);
            }
        });
        log.info("[Permissions] Revoked /{} from role {}", normalized, role);
        return true;
    }

    public synchronized boolean removeRole(String roleId) {
        String role = requireRole(roleId);
        if (!loaded().containsKey(role)) {
            return false;
        }
        mutate(current -> current.remove(role));
        log.info("[Permissions] Removed role {}", role);
        return true;
    }

    public synchronized Set<String> getRolePermissions(String roleId) {
        TreeSet<String> granted = loaded().get(requireRole(roleId));
        return granted == null ? Set.of() : Set.copyOf(granted);
    }

    /**
     * @return every role with at least one command, sorted by role id
     */
    public synchronized Map<String, Set<String>> listRoles() {
        Map<String, Set<String>> result = new TreeMap<>();
        loaded().forEach((role, commands) -> result.put(role, Set.copyOf(commands)));
        return result;
    }

    private static String requireRole(String roleId) {
        if (roleId == null || roleId.isBlank()) {
            throw new InvalidArgumentException("Role id is required");
        }
        return roleId.trim();
    }

    private static String requireCommand(String command) {
        String normalized = normalizeCommand(command);
        if (normalized.isEmpty()) {
            throw new InvalidArgumentException("Command name is required");
        }
        return normalized;
    }

    private static String normalizeCommand(String command) {
        if (command == null) {
            return "";
        }
        String trimmed = command.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith("/") ? trimmed.substring(1) : trimmed;
    }

    /**
     * Apply a change to a copy and persist it. The cache is only replaced once
     * the write succeeds.
     */
    private void mutate(Consumer<TreeMap<String, TreeSet<String>>> change) {
        TreeMap<String, TreeSet<String>> next = new TreeMap<>();
        loaded().forEach((role, commands) -> next.put(role, new TreeSet<>(commands)));
        change.accept(next);
        persist(next);
        permissions = next;
    }

    private TreeMap<String, TreeSet<String>> loaded() {
        if (permissions == null) {
            permissions = load();
        }
        return permissions;
    }

    private TreeMap<String, TreeSet<String>> load() {
        String json = StorageSupport.join(storagePort.readDocument(ROLES_DIR, PERMISSIONS_FILE), "read permissions");
        if (json == null || json.isBlank()) {
            return new TreeMap<>();
        }
        try {
            return objectMapper.readValue(json, PERMISSIONS_TYPE_REF);
        } catch (JsonProcessingException e) {
            throw new StorageException("Permissions file is unreadable", e);
        }
    }

    private void persist(TreeMap<String, TreeSet<String>> current) {
        String json;
        try {
            json = objectMapper.writeValueAsString(current);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize permissions", e);
        }
        StorageSupport.join(storagePort.writeDocument(ROLES_DIR, PERMISSIONS_FILE, json, true), "write permissions");
    }
}
