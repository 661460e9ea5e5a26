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

import me.golemcore.host.domain.exception.HostException;
import me.golemcore.host.domain.exception.InvariantViolationException;
import me.golemcore.host.domain.model.HostSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Table of live sessions and the memory handles each one owns.
 *
 * <p>
 * Alongside each session's owned set the table keeps a reverse index from
 * handle to owner, so a handle can never be committed to two sessions. All
 * state changes happen under a single reentrant lock. When a caller also needs
 * the memory registry lock, it takes this lock first through
 * {@link #locked(Supplier)}.
 *
 * <p>
 * Closing is two-step: {@link #beginClose(String)} moves the session to
 * {@code CLOSING}, after which it accepts no new handles, and
 * {@link #finishClose(String)} marks it {@code CLOSED} and drops it from the
 * table. Handles whose release failed during close are kept as orphans: owned
 * by no session, still allocated, and waiting to be reaped.
 *
 * <p>
 * {@link #size()} and {@link #liveSessionIds()} read without the lock so a
 * release stuck under it cannot stall shutdown reporting.
 */
@Service
@Slf4j
public class SessionTable {

    private static final String LOG_PREFIX = "[Session]";

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, HostSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> handleOwners = new HashMap<>();
    private final Set<String> orphanedHandles = new LinkedHashSet<>();

    public SessionTable(Clock clock) {
        this.clock = clock;
    }

    /**
     * Runs an action while holding the table lock.
     */
    public <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public HostSession create(Map<String, String> metadata) {
        Instant now = clock.instant();
        HostSession session = HostSession.builder()
                .id(UUID.randomUUID().toString())
                .createdAt(now)
                .lastActivityAt(now)
                .metadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>())
                .build();
        lock.lock();
        try {
            sessions.put(session.getId(), session);
        } finally {
            lock.unlock();
        }
        log.info("{} Created session {}", LOG_PREFIX, session.getId());
        return session.snapshot();
    }

    public Optional<HostSession> find(String sessionId) {
        lock.lock();
        try {
            return Optional.ofNullable(sessions.get(sessionId)).map(HostSession::snapshot);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the active session, refreshing its activity timestamp.
     *
     * @throws HostException
     *             {@code SESSION_NOT_FOUND} if the session is unknown or no
     *             longer active
     */
    public HostSession requireActive(String sessionId) {
        lock.lock();
        try {
            HostSession session = activeSession(sessionId);
            session.setLastActivityAt(clock.instant());
            return session.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public boolean owns(String sessionId, String handleId) {
        lock.lock();
        try {
            return sessionId != null && sessionId.equals(handleOwners.get(handleId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records that an active session owns a freshly allocated handle.
     *
     * @throws InvariantViolationException
     *             if the handle already has an owner
     */
    public void commitOwnership(String sessionId, String handleId) {
        lock.lock();
        try {
            HostSession session = activeSession(sessionId);
            String existingOwner = handleOwners.get(handleId);
            if (existingOwner != null) {
                throw new InvariantViolationException(
                        "Handle " + handleId + " already owned by session " + existingOwner);
            }
            handleOwners.put(handleId, sessionId);
            session.getOwnedHandles().add(handleId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops a handle from its owner.
     *
     * @return false if the session did not own the handle
     */
    public boolean disown(String sessionId, String handleId) {
        lock.lock();
        try {
            if (!sessionId.equals(handleOwners.get(handleId))) {
                return false;
            }
            handleOwners.remove(handleId);
            HostSession session = sessions.get(sessionId);
            if (session == null || !session.getOwnedHandles().remove(handleId)) {
                throw new InvariantViolationException(
                        "Handle " + handleId + " indexed to session " + sessionId + " but not in its owned set");
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops handles reclaimed by the memory registry from whichever sessions
     * own them. Reclaimed orphans are forgotten.
     *
     * @throws InvariantViolationException
     *             if a reclaimed handle had neither an owner nor an orphan entry
     */
    public void disownAll(Collection<String> handleIds) {
        lock.lock();
        try {
            for (String handleId : handleIds) {
                String owner = handleOwners.get(handleId);
                if (owner == null && orphanedHandles.remove(handleId)) {
                    continue;
                }
                if (owner == null) {
                    throw new InvariantViolationException("Reclaimed handle " + handleId + " had no owning session");
                }
                disown(owner, handleId);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves an active session to {@code CLOSING}.
     *
     * @return the handles owned at that moment
     */
    public Set<String> beginClose(String sessionId) {
        lock.lock();
        try {
            HostSession session = activeSession(sessionId);
            session.setStatus(HostSession.SessionStatus.CLOSING);
            log.debug("{} Closing session {} with {} handles", LOG_PREFIX, sessionId,
                    session.getOwnedHandles().size());
            return new LinkedHashSet<>(session.getOwnedHandles());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks a closing session {@code CLOSED}, moves any handles it still owns to
     * the orphan set and removes it from the table.
     */
    public HostSession finishClose(String sessionId) {
        lock.lock();
        try {
            HostSession session = sessions.get(sessionId);
            if (session == null || session.getStatus() != HostSession.SessionStatus.CLOSING) {
                throw new InvariantViolationException("Session " + sessionId + " finished closing without "
                        + "being in CLOSING state");
            }
            for (String handleId : session.getOwnedHandles()) {
                handleOwners.remove(handleId);
                orphanedHandles.add(handleId);
            }
            if (!session.getOwnedHandles().isEmpty()) {
                log.warn("{} Session {} closed with {} unreleased handles, kept as orphans", LOG_PREFIX,
                        sessionId, session.getOwnedHandles().size());
            }
            session.getOwnedHandles().clear();
            session.setStatus(HostSession.SessionStatus.CLOSED);
            session.setLastActivityAt(clock.instant());
            sessions.remove(sessionId);
            log.info("{} Closed session {}", LOG_PREFIX, sessionId);
            return session.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public List<HostSession> listLive() {
        lock.lock();
        try {
            return sessions.values().stream()
                    .sorted(Comparator.comparing(HostSession::getCreatedAt))
                    .map(HostSession::snapshot)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    public List<String> orphanedHandles() {
        lock.lock();
        try {
            return List.copyOf(orphanedHandles);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forgets an orphan once the memory registry no longer holds it.
     *
     * @return false if the handle was not an orphan
     */
    public boolean forgetOrphan(String handleId) {
        lock.lock();
        try {
            return orphanedHandles.remove(handleId);
        } finally {
            lock.unlock();
        }
    }

    public List<String> liveSessionIds() {
        return List.copyOf(sessions.keySet());
    }

    public int size() {
        return sessions.size();
    }

    public int ownedHandleCount() {
        lock.lock();
        try {
            return handleOwners.size();
        } finally {
            lock.unlock();
        }
    }

    private HostSession activeSession(String sessionId) {
        HostSession session = sessionId != null ? sessions.get(sessionId) : null;
        if (session == null || !session.isActive()) {
            throw HostException.sessionNotFound(sessionId);
        }
        return session;
    }
}
