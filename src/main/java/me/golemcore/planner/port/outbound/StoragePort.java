package me.golemcore.planner.port.outbound;

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
 * Durable workspace storage. Two shapes of data are kept:
 * <ul>
 * <li>documents: whole JSON files (jobs, polls, templates, preferences,
 * events) that are replaced atomically on every change
 * <li>journals: append-only JSONL files (the execution log), one record per
 * line
 * </ul>
 *
 * <p>
 * Every future completes exceptionally with
 * {@link me.golemcore.planner.domain.exception.StorageException} when the
 * disk did not confirm the operation.
 */
public interface StoragePort {

    /**
     * Current content of a document, or {@code null} if it was never written.
     */
    CompletableFuture<String> readDocument(String directory, String name);

    /**
     * The version a document had before its last backed-up write, or
     * {@code null} if there is none.
     */
    CompletableFuture<String> readBackup(String directory, String name);

    /**
     * Replace a document. The new content is fsynced to a temporary file and
     * renamed over the old one, so readers see either the old or the new
     * version, never a mix.
     *
     * @param keepBackup
     *            preserve the replaced version for {@link #readBackup}
     */
    CompletableFuture<Void> writeDocument(String directory, String name, String content, boolean keepBackup);

    /**
     * Append one record to a journal and fsync it. The record must be a single
     * line.
     */
    CompletableFuture<Void> appendRecord(String directory, String journal, String record);

    /**
     * Complete records of a journal, oldest first. A trailing record cut short
     * by a crash is not returned.
     */
    CompletableFuture<List<String>> readRecords(String directory, String journal);
}
