package me.golemcore.planner.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.planner.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.planner.domain.exception.InvalidArgumentException;
import me.golemcore.planner.domain.exception.StorageException;
import me.golemcore.planner.infrastructure.config.AutoConfiguration;
import me.golemcore.planner.infrastructure.config.BotProperties;
import me.golemcore.planner.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CommandPermissionServiceTest {

    private static final String ORGANIZERS = "700";
    private static final String MEMBERS = "701";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private CommandPermissionService service;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        service = new CommandPermissionService(storage, objectMapper);
    }

    @Test
    void unlistedCommandShouldBeOpenToEveryone() {
        assertTrue(service.isAllowed("poll", Set.of(), false));
        assertTrue(service.isAllowed("poll", null, false));
    }

    @Test
    void listedCommandShouldRequireListingRoleOrAdmin() {
        assertTrue(service.grant(ORGANIZERS, "/poll"));

        assertTrue(service.isAllowed("poll", Set.of(ORGANIZERS, MEMBERS), false));
        assertFalse(service.isAllowed("poll", Set.of(MEMBERS), false));
        assertFalse(service.isAllowed("POLL", Set.of(), false));
        assertTrue(service.isAllowed("poll", Set.of(), true));
        assertTrue(service.isAllowed("vote", Set.of(), false));
    }

    @Test
    void grantAndRevokeShouldReportChanges() {
        assertTrue(service.grant(ORGANIZERS, "poll"));
        assertFalse(service.grant(ORGANIZERS, "poll"));
        service.grant(ORGANIZERS, "close_poll");

        assertEquals(Set.of("poll", "close_poll"), service.getRolePermissions(ORGANIZERS));
        assertTrue(service.revoke(ORGANIZERS, "poll"));
        assertFalse(service.revoke(ORGANIZERS, "poll"));
        assertFalse(service.revoke(MEMBERS, "poll"));
        assertEquals(Set.of("close_poll"), service.getRolePermissions(ORGANIZERS));
    }

    @Test
    void revokingLastCommandShouldDropRole() {
        service.grant(ORGANIZERS, "poll");
        service.grant(MEMBERS, "vote");

        service.revoke(ORGANIZERS, "poll");

        assertEquals(Map.of(MEMBERS, Set.of("vote")), service.listRoles());
        assertTrue(service.isAllowed("poll", Set.of(), false));
    }

    @Test
    void removeRoleShouldLiftItsRestrictions() {
        service.grant(ORGANIZERS, "poll");

        assertTrue(service.removeRole(ORGANIZERS));
        assertFalse(service.removeRole(ORGANIZERS));
        assertTrue(service.listRoles().isEmpty());
    }

    @Test
    void shouldValidateInput() {
        assertThrows(InvalidArgumentException.class, () -> service.grant(" ", "poll"));
        assertThrows(InvalidArgumentException.class, () -> service.grant(ORGANIZERS, "/"));
        assertThrows(InvalidArgumentException.class, () -> service.getRolePermissions(null));
    }

    @Test
    void permissionsShouldPersistAcrossInstances() {
        service.grant(ORGANIZERS, "poll");

        CommandPermissionService reloaded = new CommandPermissionService(storage, objectMapper);

        assertEquals(Set.of("poll"), reloaded.getRolePermissions(ORGANIZERS));
        assertFalse(reloaded.isAllowed("poll", Set.of(MEMBERS), false));
    }

    @Test
    void failedWriteShouldLeavePermissionsUnchanged() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.readDocument(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(failing.writeDocument(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new java.io.UncheckedIOException(
                        new java.io.IOException("disk full"))));
        CommandPermissionService failingService = new CommandPermissionService(failing, objectMapper);

        assertThrows(StorageException.class, () -> failingService.grant(ORGANIZERS, "poll"));
        assertTrue(failingService.listRoles().isEmpty());
        assertTrue(failingService.isAllowed("poll", Set.of(), false));
    }
}
