package me.golemcore.host.domain.service;

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

import me.golemcore.host.domain.exception.InvariantViolationException;
import me.golemcore.host.infrastructure.config.HostProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Terminates the host on a broken resource-tracking invariant. Once faulted,
 * every later request is refused with the original fault.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FatalErrorHandler {

    static final int EXIT_CODE = 70;

    private final JvmExitService jvmExitService;
    private final HostProperties properties;
    private final AtomicReference<InvariantViolationException> fault = new AtomicReference<>();

    public void halt(InvariantViolationException violation) {
        if (!fault.compareAndSet(null, violation)) {
            return;
        }
        log.error("[Kernel] Invariant violated, halting host: {}", violation.getMessage(), violation);
        if (properties.getKernel().isExitOnInvariantViolation()) {
            jvmExitService.halt(EXIT_CODE);
        }
    }

    public void ensureHealthy() {
        InvariantViolationException violation = fault.get();
        if (violation != null) {
            throw new InvariantViolationException("Host halted after invariant violation: "
                    + violation.getMessage());
        }
    }

    public boolean isFaulted() {
        return fault.get() != null;
    }
}
