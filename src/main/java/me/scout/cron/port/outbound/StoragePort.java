package me.scout.cron.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the cron workspace's document files.
 *
 * <p>
 * Documents live in a named collection ({@code jobs}, {@code schedules},
 * {@code runs}, {@code events}) under a file name. Every operation completes
 * asynchronously; I/O failures complete the future exceptionally with an
 * {@link IllegalStateException}, and a name escaping its collection with an
 * {@link IllegalArgumentException}.
 */
public interface StoragePort {

    /**
     * @return the document text, or {@code null} if there is no such document
     */
    CompletableFuture<String> readDocument(String collection, String name);

    /**
     * Replace a document without ever exposing a partial write: the content
     * goes to a synced {@code .tmp} sibling first and is then moved over the
     * target.
     *
     * @param keepBackup
     *            copy the previous version to a {@code .bak} sibling before
     *            replacing it
     */
    CompletableFuture<Void> writeDocument(String collection, String name, String content, boolean keepBackup);

    /**
     * Append one line to a journal document, creating it if needed. A line
     * separator is added when {@code line} does not end with one.
     */
    CompletableFuture<Void> appendLine(String collection, String name, String line);

    /**
     * Remove a document and its backup. Missing documents are ignored.
     */
    CompletableFuture<Void> deleteDocument(String collection, String name);

    CompletableFuture<Boolean> documentExists(String collection, String name);

    /**
     * Names of the documents in a collection, sorted, without temporary or
     * backup files. Empty if the collection does not exist yet.
     */
    CompletableFuture<List<String>> listDocuments(String collection);
}
