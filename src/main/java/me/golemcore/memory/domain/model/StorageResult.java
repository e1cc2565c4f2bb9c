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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Tagged result of a memory write: status, human-readable message and the
 * payload relevant to that status (stored id and topics on success, the
 * conflicting entry and its score on a duplicate rejection).
 */
@Value
@Builder
public class StorageResult {

    StorageStatus status;
    String message;
    String memoryId;
    List<String> topics;
    String conflictingId;
    Double similarityScore;

    public boolean isSuccess() {
        return status.isSuccess();
    }

    public boolean isRejected() {
        return status.isRejected();
    }

    public static StorageResult success(String memoryId, List<String> topics, String message) {
        return StorageResult.builder()
                .status(StorageStatus.SUCCESS)
                .message(message)
                .memoryId(memoryId)
                .topics(List.copyOf(topics))
                .build();
    }

    public static StorageResult duplicate(DuplicateVerdict verdict, String conflictingText) {
        boolean exact = verdict.getKind() == DuplicateVerdict.Kind.EXACT;
        return StorageResult.builder()
                .status(exact ? StorageStatus.DUPLICATE_EXACT : StorageStatus.DUPLICATE_SEMANTIC)
                .message((exact ? "Exact duplicate of: '" : "Semantic duplicate of: '") + conflictingText + "'")
                .conflictingId(verdict.getMatchId())
                .similarityScore(verdict.getScore())
                .build();
    }

    public static StorageResult failure(StorageStatus status, String message) {
        return StorageResult.builder()
                .status(status)
                .message(message)
                .build();
    }
}
