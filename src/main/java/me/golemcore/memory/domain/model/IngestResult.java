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
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of extracting memorable statements from free text and admitting each
 * of them.
 */
@Value
@Builder
public class IngestResult {

    @Singular("addedResult")
    List<StorageResult> added;
    @Singular("rejectedResult")
    List<StorageResult> rejected;

    public int getAddedCount() {
        return added.size();
    }

    public int getRejectedCount() {
        return rejected.size();
    }

    public static IngestResult empty() {
        return IngestResult.builder().build();
    }
}
