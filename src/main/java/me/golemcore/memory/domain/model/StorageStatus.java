package me.golemcore.memory.domain.model;

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

/**
 * Outcome of a memory write operation.
 */
public enum StorageStatus {

    SUCCESS,
    DUPLICATE_EXACT,
    DUPLICATE_SEMANTIC,
    CONTENT_EMPTY,
    CONTENT_TOO_LONG,
    VALIDATION_ERROR,
    STORAGE_ERROR;

    public boolean isSuccess() {
        return this == SUCCESS;
    }

    /**
     * Rejections are designed no-op outcomes, not failures; callers should
     * not retry them.
     */
    public boolean isRejected() {
        return this == DUPLICATE_EXACT
                || this == DUPLICATE_SEMANTIC
                || this == CONTENT_EMPTY
                || this == CONTENT_TOO_LONG
                || this == VALIDATION_ERROR;
    }

    public boolean isDuplicate() {
        return this == DUPLICATE_EXACT || this == DUPLICATE_SEMANTIC;
    }
}
