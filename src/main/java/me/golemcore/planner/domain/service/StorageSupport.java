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

import me.golemcore.planner.domain.exception.StorageException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Blocking bridge over {@link me.golemcore.planner.port.outbound.StoragePort}
 * futures that surfaces every failure as {@link StorageException}.
 */
public final class StorageSupport {

    private StorageSupport() {
    }

    public static <T> T join(CompletableFuture<T> future, String description) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof StorageException storageException) {
                throw storageException;
            }
            throw new StorageException("Storage operation failed: " + description, cause);
        } catch (RuntimeException e) { // NOSONAR - adapters may fail synchronously
            if (e instanceof StorageException storageException) {
                throw storageException;
            }
            throw new StorageException("Storage operation failed: " + description, e);
        }
    }
}
