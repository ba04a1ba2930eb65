package com.aerox.orchestrator.negotiation;

import com.aerox.common.exception.SessionNotFoundException;
import com.aerox.common.negotiation.NegotiationSession;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * In-memory owner of negotiation sessions.
 *
 * <p>Work against a session is submitted through {@link #submit}, which chains it behind
 * whatever is already queued for that session: a unit of work subscribes only after the
 * previous one has terminated, so at most one runs per session. Sessions never wait on each
 * other and no thread is blocked. A failed unit does not poison the queue.
 *
 * <p>Once submitted, a unit runs to completion even if its subscriber cancels: a round whose
 * HTTP caller disconnects is still applied to the session, and a retried message counts as a
 * new round. When the last queued unit terminates the queue is reset to empty, so finished
 * work is not retained.
 */
@Component
public class NegotiationSessionStore {

    private record Entry(NegotiationSession session, Mono<Void> tail) {}

    private static final Mono<Void> EMPTY = Mono.empty();

    private final ConcurrentHashMap<String, Entry> sessions = new ConcurrentHashMap<>();

    public NegotiationSession register(NegotiationSession session) {
        if (sessions.putIfAbsent(session.sessionId(), new Entry(session, EMPTY)) != null) {
            throw new IllegalStateException("duplicate session id " + session.sessionId());
        }
        return session;
    }

    /**
     * Queues {@code work} for the session and returns its result. The returned Mono is cached:
     * the work runs once even if it is subscribed several times or only by a later submission.
     *
     * @return the work's result, or {@link SessionNotFoundException} when the id is unknown
     */
    public <T> Mono<T> submit(String sessionId, Function<NegotiationSession, Mono<T>> work) {
        AtomicReference<Mono<T>> scheduled = new AtomicReference<>();
        AtomicReference<Mono<Void>> tail = new AtomicReference<>();
        Entry updated = sessions.computeIfPresent(sessionId, (id, entry) -> {
            Mono<T> next = entry.tail()
                .onErrorResume(e -> Mono.empty())
                .then(Mono.defer(() -> work.apply(entry.session())))
                .doFinally(signal -> release(id, tail.get()))
                .cache();
            scheduled.set(next);
            tail.set(next.then());
            return new Entry(entry.session(), tail.get());
        });
        if (updated == null) {
            return Mono.error(new SessionNotFoundException(sessionId));
        }
        return scheduled.get();
    }

    /** Drops the finished chain unless later work has been queued behind it. */
    private void release(String sessionId, Mono<Void> finishedTail) {
        sessions.computeIfPresent(sessionId, (id, entry) ->
            entry.tail() == finishedTail ? new Entry(entry.session(), EMPTY) : entry);
    }

    /** True when no work is queued or running for the session. */
    boolean isIdle(String sessionId) {
        Entry entry = sessions.get(sessionId);
        return entry != null && entry.tail() == EMPTY;
    }

    public boolean contains(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public boolean remove(String sessionId) {
        return sessions.remove(sessionId) != null;
    }
}
