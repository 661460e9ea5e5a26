package me.golemcore.host.domain.exception;

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

import me.golemcore.host.domain.model.ErrorKind;

/**
 * Recoverable request failure. The dispatcher turns it into the failure branch
 * of the response envelope; it never terminates the host.
 */
public class HostException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public HostException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public HostException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static HostException sessionNotFound(String sessionId) {
        return new HostException(ErrorKind.SESSION_NOT_FOUND, "Session " + sessionId + " not found");
    }

    public static HostException permissionDenied(String triple) {
        return new HostException(ErrorKind.PERMISSION_DENIED, "Permission denied: " + triple);
    }

    public static HostException invalidArgument(String message) {
        return new HostException(ErrorKind.INVALID_ARGUMENT, message);
    }

    public static HostException handleNotFound(String handleId) {
        return new HostException(ErrorKind.HANDLE_NOT_FOUND, "No memory allocation found for handle " + handleId);
    }

    public static HostException toolNotFound(String message) {
        return new HostException(ErrorKind.TOOL_NOT_FOUND, message);
    }
}
