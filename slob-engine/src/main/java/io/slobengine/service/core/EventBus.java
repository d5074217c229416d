package io.slobengine.service.core;

import io.slobengine.domain.common.EventType;
import io.slobengine.domain.event.EngineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process typed publish/subscribe.
 *
 * DISPATCH:
 * - Handlers are registered per event class; one class per {@link EventType}.
 * - publish() records history and queues one task per handler, then returns.
 * - All handlers run on a single dispatch thread, so events are delivered in publish order.
 *   Candle events reach the setup tracker strictly in candle order.
 * - publishAndWait() blocks until every handler of that event has finished (safe-mode events).
 *
 * FAILURE ISOLATION:
 * A handler exception is logged and counted; the remaining handlers still run and
 * the publisher never sees it.
 */
public final class EventBus {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_HISTORY_SIZE = 1000;

    private final Map<Class<?>, List<EventHandler<? super EngineEvent>>> handlers = new ConcurrentHashMap<>();
    private final List<EventHandler<? super EngineEvent>> globalHandlers = new CopyOnWriteArrayList<>();

    private final Deque<EngineEvent> history = new ArrayDeque<>();
    private final int historySize;

    private final ExecutorService dispatcher;
    private volatile Thread dispatchThread;
    private volatile boolean accepting = true;

    private final AtomicLong eventsPublished = new AtomicLong();
    private final AtomicLong handlersInvoked = new AtomicLong();
    private final AtomicLong handlerErrors = new AtomicLong();
    private final AtomicLong eventsDropped = new AtomicLong();

    public EventBus() {
        this(DEFAULT_HISTORY_SIZE);
    }

    public EventBus(int historySize) {
        if (historySize < 0) {
            throw new IllegalArgumentException("History size cannot be negative");
        }
        this.historySize = historySize;
        this.dispatcher = Executors.newSingleThreadExecutor(runnable -> {
            Thread t = new Thread(runnable, "event-bus-dispatch");
            t.setDaemon(true);
            dispatchThread = t;
            return t;
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // SUBSCRIPTION
    // ═══════════════════════════════════════════════════════════════

    /**
     * Subscribe to one event kind.
     */
    @SuppressWarnings("unchecked")
    public <E extends EngineEvent> void subscribe(Class<E> eventClass, EventHandler<? super E> handler) {
        if (eventClass == null || handler == null) {
            throw new IllegalArgumentException("Event class and handler are required");
        }
        EventHandler<? super EngineEvent> erased = (EventHandler<? super EngineEvent>) (EventHandler<?>) handler;
        handlers.computeIfAbsent(eventClass, k -> new CopyOnWriteArrayList<>()).add(erased);
        log.debug("[EventBus] Subscribed handler to {}", eventClass.getSimpleName());
    }

    /**
     * Subscribe to every event kind (dashboards, metrics, audit).
     */
    public void subscribeAll(EventHandler<? super EngineEvent> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("Handler is required");
        }
        globalHandlers.add(handler);
    }

    public <E extends EngineEvent> boolean unsubscribe(Class<E> eventClass, EventHandler<? super E> handler) {
        List<EventHandler<? super EngineEvent>> list = handlers.get(eventClass);
        return list != null && list.remove(handler);
    }

    public int subscriberCount(Class<? extends EngineEvent> eventClass) {
        List<EventHandler<? super EngineEvent>> list = handlers.get(eventClass);
        return list == null ? 0 : list.size();
    }

    // ═══════════════════════════════════════════════════════════════
    // PUBLISH
    // ═══════════════════════════════════════════════════════════════

    /**
     * Queue the event for every subscriber and return without waiting.
     */
    public void publish(EngineEvent event) {
        List<EventHandler<? super EngineEvent>> targets = prepare(event);
        if (targets == null) {
            return;
        }
        for (EventHandler<? super EngineEvent> handler : targets) {
            try {
                dispatcher.execute(() -> invokeSafely(handler, event));
            } catch (RejectedExecutionException e) {
                eventsDropped.incrementAndGet();
                log.warn("[EventBus] Dispatcher closed, dropped {} for one handler", event.type());
            }
        }
    }

    /**
     * Deliver the event and block until every subscriber has handled it or the timeout expires.
     *
     * @return true if all handlers finished in time
     */
    public boolean publishAndWait(EngineEvent event, Duration timeout) {
        List<EventHandler<? super EngineEvent>> targets = prepare(event);
        if (targets == null) {
            return false;
        }

        // Already on the dispatch thread: queued work would wait behind us, run inline instead.
        if (Thread.currentThread() == dispatchThread) {
            targets.forEach(h -> invokeSafely(h, event));
            return true;
        }

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (EventHandler<? super EngineEvent> handler : targets) {
            try {
                futures.add(CompletableFuture.runAsync(() -> invokeSafely(handler, event), dispatcher));
            } catch (RejectedExecutionException e) {
                eventsDropped.incrementAndGet();
                log.warn("[EventBus] Dispatcher closed, running {} handler inline", event.type());
                invokeSafely(handler, event);
            }
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("[EventBus] Handlers for {} did not finish within {}ms", event.type(), timeout.toMillis());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            log.error("[EventBus] Unexpected dispatch failure for {}", event.type(), e.getCause());
            return false;
        }
    }

    private List<EventHandler<? super EngineEvent>> prepare(EngineEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        if (!accepting) {
            eventsDropped.incrementAndGet();
            log.debug("[EventBus] Shut down, ignoring {}", event.type());
            return null;
        }
        eventsPublished.incrementAndGet();
        record(event);

        List<EventHandler<? super EngineEvent>> targets = new ArrayList<>();
        List<EventHandler<? super EngineEvent>> typed = handlers.get(event.getClass());
        if (typed != null) {
            targets.addAll(typed);
        }
        targets.addAll(globalHandlers);
        return targets;
    }

    private void invokeSafely(EventHandler<? super EngineEvent> handler, EngineEvent event) {
        handlersInvoked.incrementAndGet();
        try {
            handler.handle(event);
        } catch (Exception e) {
            handlerErrors.incrementAndGet();
            log.error("[EventBus] Handler failed for {}: {}", event.type(), e.getMessage(), e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // HISTORY
    // ═══════════════════════════════════════════════════════════════

    private void record(EngineEvent event) {
        if (historySize == 0) {
            return;
        }
        synchronized (history) {
            if (history.size() >= historySize) {
                history.removeFirst();
            }
            history.addLast(event);
        }
    }

    /**
     * Most recent events, oldest first.
     *
     * @param type  kind filter, or null for all
     * @param limit maximum number of events returned
     */
    public List<EngineEvent> getHistory(EventType type, int limit) {
        List<EngineEvent> result = new ArrayList<>();
        synchronized (history) {
            Iterator<EngineEvent> it = history.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                EngineEvent e = it.next();
                if (type == null || e.type() == type) {
                    result.add(0, e);
                }
            }
        }
        return result;
    }

    public void clearHistory() {
        synchronized (history) {
            history.clear();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Stop accepting events and drain what is already queued.
     *
     * @return true if the queue drained within the timeout
     */
    public boolean shutdown(Duration timeout) {
        accepting = false;
        log.info("[EventBus] Shutting down, draining pending dispatches");
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> abandoned = dispatcher.shutdownNow();
                eventsDropped.addAndGet(abandoned.size());
                log.warn("[EventBus] Drain timed out, abandoned {} dispatches", abandoned.size());
                return false;
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
        log.info("[EventBus] Stopped (published={}, handlerErrors={})",
            eventsPublished.get(), handlerErrors.get());
        return true;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public long getHandlerErrors() {
        return handlerErrors.get();
    }

    public Map<String, Long> getStats() {
        Map<String, Long> stats = new LinkedHashMap<>();
        stats.put("eventsPublished", eventsPublished.get());
        stats.put("handlersInvoked", handlersInvoked.get());
        stats.put("handlerErrors", handlerErrors.get());
        stats.put("eventsDropped", eventsDropped.get());
        synchronized (history) {
            stats.put("historySize", (long) history.size());
        }
        return stats;
    }
}
