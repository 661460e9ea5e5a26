package me.golemcore.host.domain.model;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Uniform response envelope. Exactly one of {@code data} or
 * {@code errorKind}/{@code error} is meaningful, depending on
 * {@code success}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HostResponse {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String id;
    private Object data;
    private ErrorKind errorKind;
    private String error;
    private long timestamp;

    public static HostResponse success(String id, Object data, long timestamp) {
        return HostResponse.builder()
                .id(id)
                .success(true)
                .data(data)
                .timestamp(timestamp)
                .build();
    }

    public static HostResponse failure(String id, ErrorKind kind, String message, long timestamp) {
        return HostResponse.builder()
                .id(id)
                .success(false)
                .errorKind(kind)
                .error(message)
                .timestamp(timestamp)
                .build();
    }

    /**
     * Failure that still carries a payload, used when a shutdown drain times out
     * and the caller needs the straggler list.
     */
    public static HostResponse failure(String id, ErrorKind kind, String message, Object data, long timestamp) {
        HostResponse response = failure(id, kind, message, timestamp);
        response.setData(data);
        return response;
    }
}
