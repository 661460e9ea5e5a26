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

/**
 * Machine-readable classification of request failures carried in the response
 * envelope. Every kind is recoverable from the caller's point of view.
 */
public enum ErrorKind {

    SESSION_NOT_FOUND,

    PERMISSION_DENIED,

    QUOTA_EXCEEDED,

    INVALID_ARGUMENT,

    HANDLE_NOT_FOUND,

    TOOL_NOT_FOUND,

    CAPABILITY_NOT_FOUND,

    /**
     * The tool was found but its execution failed, timed out or reported a
     * failed result. The message carries the underlying cause.
     */
    TOOL_EXECUTION_ERROR,

    /**
     * Shutdown drain timed out before every session was closed.
     */
    SHUTDOWN_INCOMPLETE,

    /**
     * The host has been shut down and no longer accepts requests.
     */
    HOST_NOT_RUNNING
}
