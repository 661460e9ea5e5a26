package me.golemcore.host.tools;

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

import me.golemcore.host.domain.component.ToolComponent;
import me.golemcore.host.domain.model.ToolCapability;
import me.golemcore.host.domain.model.ToolDescriptor;
import me.golemcore.host.domain.model.ToolResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool for getting current date and time.
 *
 * <p>
 * Capability {@code now} returns the current date/time in a specified timezone
 * (or UTC). Output includes formatted string and structured data (year, month,
 * day, hour, minute, etc.).
 *
 * <p>
 * Timezone parameter examples: {@code "America/New_York"},
 * {@code "Europe/London"}, {@code "UTC"}
 */
@Component
@RequiredArgsConstructor
public class DateTimeTool implements ToolComponent {

    static final String TOOL_ID = "datetime";

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final Clock clock;

    @Override
    public ToolDescriptor getDescriptor() {
        return ToolDescriptor.builder()
                .id(TOOL_ID)
                .name("Date and time")
                .description("Get the current date and time. Optionally specify a timezone.")
                .version("1.0.0")
                .categories(List.of("time"))
                .capabilities(List.of(ToolCapability.builder()
                        .name("now")
                        .description("Current date and time")
                        .parameters(List.of(ToolCapability.ToolParameter.optional("timezone", "string",
                                "Timezone (e.g., 'America/New_York', 'Europe/London', 'UTC'). Default is UTC.")))
                        .returnType("string")
                        .build()))
                .enabled(true)
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(String capability, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            if (!"now".equals(capability)) {
                return ToolResult.failure("Unknown capability: " + capability);
            }
            Object timezone = parameters.get("timezone");
            ZoneId zoneId;
            if (timezone != null && !timezone.toString().isBlank()) {
                try {
                    zoneId = ZoneId.of(timezone.toString());
                } catch (DateTimeException e) {
                    return ToolResult.failure("Invalid timezone: " + timezone);
                }
            } else {
                zoneId = ZoneId.of("UTC");
            }

            ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
            String formatted = now.format(FORMATTER);

            Map<String, Object> data = Map.of(
                    "datetime", formatted,
                    "timezone", zoneId.getId(),
                    "timestamp", now.toInstant().toEpochMilli(),
                    "dayOfWeek", now.getDayOfWeek().name(),
                    "year", now.getYear(),
                    "month", now.getMonth().name(),
                    "day", now.getDayOfMonth(),
                    "hour", now.getHour(),
                    "minute", now.getMinute());

            return ToolResult.success(formatted, data);
        });
    }
}
