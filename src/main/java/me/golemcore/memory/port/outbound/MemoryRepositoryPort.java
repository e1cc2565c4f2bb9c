package me.golemcore.memory.port.outbound;

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

import me.golemcore.memory.domain.model.MemoryEntry;

import java.util.List;

/**
 * Port for memory persistence. Implementations only store and return entries:
 * admission control, ownership checks and write serialization per owner live
 * in the domain layer.
 *
 * <p>
 * All methods signal failure with {@link MemoryStorageException}.
 */
public interface MemoryRepositoryPort {

    /**
     * Read every entry belonging to an owner, oldest first.
     *
     * @param ownerId
     *            owner namespace
     * @return entries, empty if the owner has none
     */
    List<MemoryEntry> readAll(String ownerId);

    /**
     * Insert or replace an entry, keyed by its id.
     *
     * @param entry
     *            entry to persist
     * @return the stored entry id
     */
    String write(MemoryEntry entry);

    /**
     * Delete one of an owner's entries by id. Entries of other owners are never
     * touched, even when they share the id.
     *
     * @return {@code true} if an entry was removed
     */
    boolean delete(String memoryId, String ownerId);
}
