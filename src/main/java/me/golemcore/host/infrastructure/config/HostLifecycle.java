package me.golemcore.host.infrastructure.config;

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

import me.golemcore.host.domain.model.ShutdownReport;
import me.golemcore.host.domain.service.RequestDispatcher;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Drains live sessions when the application context closes, so handles are
 * released even when the host is stopped without a {@code system_shutdown}
 * request.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HostLifecycle {

    private final RequestDispatcher dispatcher;
    private final HostProperties properties;

    @PreDestroy
    public void stop() {
        ShutdownReport report = dispatcher.shutdown(properties.getKernel().getShutdownDrainTimeout());
        if (!report.isComplete()) {
            log.warn("[Kernel] Context closing with {} sessions still live", report.getStragglers().size());
        }
    }
}
