package me.golemcore.host;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Host.
 *
 * <p>
 * GolemCore Host is the request dispatch core of an agent host runtime:
 * clients open sessions and send typed requests that are checked against a
 * permission policy and routed to the subsystem owning the resource.
 *
 * <h2>Subsystems</h2>
 * <ul>
 * <li><b>Sessions</b> - lifecycle and ownership of memory handles</li>
 * <li><b>Memory</b> - categorized allocations with quotas and idle
 * optimization</li>
 * <li><b>Security</b> - allow/deny rules under a security level, audit
 * log</li>
 * <li><b>Tools</b> - registry of tool components and their capabilities</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → HostController (WebFlux)
 * Domain Layer       → RequestDispatcher, SessionTable, Services
 * Infrastructure     → Local storage adapter, configuration
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code host.*}
 * prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class HostApplication {

    public static void main(String[] args) {
        SpringApplication.run(HostApplication.class, args);
    }

}
