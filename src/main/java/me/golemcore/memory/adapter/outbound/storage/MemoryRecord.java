package me.golemcore.memory.adapter.outbound.storage;

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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Persisted JSON shape of a memory entry (one JSONL line).
 *
 * <p>
 * Field names are snake_case. Rows written by older versions use
 * {@code memory_id}, {@code user_id}, {@code memory} and {@code last_updated},
 * may lack {@code confidence} and {@code is_proxy}, and may carry topics as a
 * string; all of these are accepted on read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MemoryRecord {

    @JsonProperty("id")
    @JsonAlias("memory_id")
    private String id;

    @JsonProperty("owner_id")
    @JsonAlias("user_id")
    private String ownerId;

    @JsonProperty("text")
    @JsonAlias("memory")
    private String text;

    @JsonDeserialize(using = TopicListDeserializer.class)
    private List<String> topics;

    private Double confidence;

    @JsonProperty("is_proxy")
    private Boolean proxy;

    @JsonProperty("proxy_agent")
    private String proxyAgent;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("updated_at")
    @JsonAlias("last_updated")
    private String updatedAt;
}
