package me.scout.cron.adapter.outbound.storage;

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

import me.scout.cron.infrastructure.config.CronProperties;
import me.scout.cron.port.outbound.StoragePort;
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
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Keeps cron documents as files under {@code cron.storage.local.base-path}
 * (default {@code ${user.home}/.scout/cron}), one directory per collection:
 * <ul>
 * <li>jobs/ - job definitions
 * <li>schedules/ - per-job schedule state
 * <li>runs/ - run records
 * <li>events/ - run event journals (JSONL)
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    static final List<String> COLLECTIONS = List.of("jobs", "schedules", "runs", "events", "artifacts");

    private static final String TMP_SUFFIX = ".tmp";
    private static final String BACKUP_SUFFIX = ".bak";

    private final CronProperties properties;

    private Path root;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath();
        root = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            for (String collection : COLLECTIONS) {
                Files.createDirectories(root.resolve(collection));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create cron storage at " + root, e);
        }
        log.info("[Storage] Cron documents stored under {}", root);
    }

    @Override
    public CompletableFuture<String> readDocument(String collection, String name) {
        return async("read", collection, name, () -> {
            Path file = locate(collection, name);
            return Files.isRegularFile(file) ? Files.readString(file, StandardCharsets.UTF_8) : null;
        });
    }

    @Override
    public CompletableFuture<Void> writeDocument(String collection, String name, String content,
            boolean keepBackup) {
        return async("write", collection, name, () -> {
            Path target = locate(collection, name);
            Path temp = sibling(target, TMP_SUFFIX);
            try {
                writeSynced(temp, content.getBytes(StandardCharsets.UTF_8));
                if (keepBackup && Files.exists(target)) {
                    Files.copy(target, sibling(target, BACKUP_SUFFIX), StandardCopyOption.REPLACE_EXISTING);
                }
                moveIntoPlace(temp, target);
            } catch (IOException e) {
                Files.deleteIfExists(temp);
                throw e;
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> appendLine(String collection, String name, String line) {
        return async("append to", collection, name, () -> {
            Path file = locate(collection, name);
            Files.createDirectories(file.getParent());
            String text = line.endsWith("\n") ? line : line + "\n";
            Files.writeString(file, text, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> deleteDocument(String collection, String name) {
        return async("delete", collection, name, () -> {
            Path file = locate(collection, name);
            Files.deleteIfExists(file);
            Files.deleteIfExists(sibling(file, BACKUP_SUFFIX));
            return null;
        });
    }

    @Override
    public CompletableFuture<Boolean> documentExists(String collection, String name) {
        return async("check", collection, name, () -> Files.isRegularFile(locate(collection, name)));
    }

    @Override
    public CompletableFuture<List<String>> listDocuments(String collection) {
        return async("list", collection, "", () -> {
            Path dir = locate(collection, "");
            if (!Files.isDirectory(dir)) {
                return List.of();
            }
            try (Stream<Path> files = Files.list(dir)) {
                return files.filter(Files::isRegularFile)
                        .map(file -> file.getFileName().toString())
                        .filter(fileName -> !fileName.endsWith(TMP_SUFFIX) && !fileName.endsWith(BACKUP_SUFFIX))
                        .sorted()
                        .toList();
            }
        });
    }

    private static void writeSynced(Path temp, byte[] bytes) throws IOException {
        Files.createDirectories(temp.getParent());
        try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        if (Files.size(temp) != bytes.length) {
            throw new IOException("Short write to " + temp);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic move unsupported for {}, falling back to plain move", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static Path sibling(Path file, String suffix) {
        return file.resolveSibling(file.getFileName() + suffix);
    }

    private Path locate(String collection, String name) {
        Path dir = root.resolve(collection).normalize();
        Path resolved = dir.resolve(name).normalize();
        if (!dir.startsWith(root) || !resolved.startsWith(dir)) {
            throw new IllegalArgumentException("Document outside cron storage: " + collection + "/" + name);
        }
        return resolved;
    }

    private static <T> CompletableFuture<T> async(String action, String collection, String name, IoAction<T> io) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return io.run();
            } catch (IOException e) {
                throw new IllegalStateException("Failed to " + action + " " + collection + "/" + name, e);
            }
        });
    }

    @FunctionalInterface
    private interface IoAction<T> {
        T run() throws IOException;
    }
}
