package me.golemcore.planner.adapter.outbound.storage;

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

import me.golemcore.planner.domain.exception.StorageException;
import me.golemcore.planner.infrastructure.config.BotProperties;
import me.golemcore.planner.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link StoragePort} over a local workspace directory:
 * <ul>
 * <li>reminders/ - jobs.json, templates.json, executions.jsonl
 * <li>polls/ - polls.json
 * <li>preferences/ - one document per user
 * <li>calendar/ - events.json
 * </ul>
 *
 * <p>
 * Base path configured via {@code bot.storage.local.base-path}, defaults to
 * {@code ${user.home}/.golemcore/planner}. A workspace that cannot be created
 * fails startup, since no reminder could be made durable.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final List<String> WORKSPACE_DIRECTORIES = List.of("reminders", "polls", "preferences",
            "calendar", "roles");
    private static final String TEMP_SUFFIX = ".tmp";
    private static final String BACKUP_SUFFIX = ".bak";
    private static final char RECORD_SEPARATOR = '\n';

    private final BotProperties properties;

    private Path workspace;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath();
        workspace = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath()
                .normalize();
        try {
            for (String directory : WORKSPACE_DIRECTORIES) {
                Files.createDirectories(workspace.resolve(directory));
            }
        } catch (IOException e) {
            throw new StorageException("Cannot create workspace at " + workspace, e);
        }
        log.info("[Storage] Workspace ready at {}", workspace);
    }

    @Override
    public CompletableFuture<String> readDocument(String directory, String name) {
        return CompletableFuture.supplyAsync(() -> readIfExists(locate(directory, name)));
    }

    @Override
    public CompletableFuture<String> readBackup(String directory, String name) {
        return CompletableFuture.supplyAsync(() -> readIfExists(sibling(locate(directory, name), BACKUP_SUFFIX)));
    }

    @Override
    public CompletableFuture<Void> writeDocument(String directory, String name, String content, boolean keepBackup) {
        return CompletableFuture.runAsync(() -> {
            Path target = locate(directory, name);
            Path temp = sibling(target, TEMP_SUFFIX);
            try {
                Files.createDirectories(target.getParent());
                writeSynced(temp, content.getBytes(StandardCharsets.UTF_8));
                if (keepBackup && Files.exists(target)) {
                    Files.copy(target, sibling(target, BACKUP_SUFFIX), StandardCopyOption.REPLACE_EXISTING);
                }
                replace(temp, target);
                log.debug("[Storage] Wrote {}/{} ({} chars)", directory, name, content.length());
            } catch (IOException e) {
                discard(temp);
                throw new StorageException("Failed to write " + directory + "/" + name, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> appendRecord(String directory, String journal, String record) {
        if (record.indexOf(RECORD_SEPARATOR) >= 0) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Journal records must be a single line"));
        }
        return CompletableFuture.runAsync(() -> {
            Path target = locate(directory, journal);
            try {
                Files.createDirectories(target.getParent());
                Files.writeString(target, record + RECORD_SEPARATOR, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.SYNC);
            } catch (IOException e) {
                throw new StorageException("Failed to append to " + directory + "/" + journal, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> readRecords(String directory, String journal) {
        return CompletableFuture.supplyAsync(() -> {
            String text = readIfExists(locate(directory, journal));
            List<String> records = new ArrayList<>();
            if (text == null) {
                return records;
            }
            int start = 0;
            int end;
            while ((end = text.indexOf(RECORD_SEPARATOR, start)) >= 0) {
                String record = text.substring(start, end);
                if (!record.isBlank()) {
                    records.add(record);
                }
                start = end + 1;
            }
            if (start < text.length()) {
                log.warn("[Storage] Ignoring incomplete last record in {}/{}", directory, journal);
            }
            return records;
        });
    }

    private static String readIfExists(Path path) {
        try {
            return Files.exists(path) ? Files.readString(path, StandardCharsets.UTF_8) : null;
        } catch (IOException e) {
            throw new StorageException("Failed to read " + path.getFileName(), e);
        }
    }

    private static void writeSynced(Path path, byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        if (Files.size(path) != bytes.length) {
            throw new IOException("Size mismatch after writing " + path.getFileName());
        }
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic rename unsupported for {}, falling back to plain move", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("[Storage] Could not remove {}: {}", temp, e.getMessage());
        }
    }

    private static Path sibling(Path path, String suffix) {
        return path.resolveSibling(path.getFileName() + suffix);
    }

    private Path locate(String directory, String name) {
        Path resolved = workspace.resolve(directory).resolve(name).normalize();
        if (!resolved.startsWith(workspace.resolve(directory))) {
            throw new IllegalArgumentException("Path escapes the workspace: " + directory + "/" + name);
        }
        return resolved;
    }
}
