package com.koni.uns.infrastructure.messaging;

import com.koni.uns.application.port.EventBus;
import com.koni.uns.domain.event.DomainEvent;
import com.koni.uns.infrastructure.observability.UnsMetrics;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Single-process implementation of the {@link EventBus} port.
 *
 * Subscribers are kept per concrete event class in registration order. Synchronous
 * subscribers run on the publishing thread; each asynchronous subscriber owns a
 * single-threaded executor, so its events are handled one at a time in publish order
 * without ever blocking the publisher.
 *
 * Events are not persisted: an event published while its class has no subscriber is dropped.
 */
@Slf4j
@Component
public class InMemoryEventBus implements EventBus {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final Map<Class<? extends DomainEvent>, List<Subscriber<?>>> subscribers = new ConcurrentHashMap<>();
    private final UnsMetrics metrics;

    public InMemoryEventBus(UnsMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public <E extends DomainEvent> Subscription subscribe(Class<E> eventType, Consumer<? super E> handler) {
        return subscribe(eventType, handler, DispatchMode.SYNC);
    }

    @Override
    public <E extends DomainEvent> Subscription subscribe(Class<E> eventType, Consumer<? super E> handler,
                                                          DispatchMode mode) {
        if (eventType == null) {
            throw new IllegalArgumentException("Event type cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }

        Subscriber<E> subscriber = new Subscriber<>(eventType, handler, mode == DispatchMode.ASYNC);
        List<Subscriber<?>> list = subscribers.computeIfAbsent(eventType, type -> new CopyOnWriteArrayList<>());
        list.add(subscriber);
        log.debug("Subscribed to event: type={}, mode={}, subscribers={}", eventType.getSimpleName(), mode, list.size());

        return () -> {
            if (list.remove(subscriber)) {
                subscriber.shutdown();
                log.debug("Unsubscribed from event: type={}", eventType.getSimpleName());
            }
        };
    }

    @Override
    public void publish(DomainEvent event) {
        if (event == null) {
            log.warn("Ignoring null event");
            return;
        }

        List<Subscriber<?>> list = subscribers.get(event.getClass());
        if (list == null || list.isEmpty()) {
            log.debug("No subscribers, dropping event: type={}", event.getClass().getSimpleName());
            return;
        }

        for (Subscriber<?> subscriber : list) {
            subscriber.dispatch(event);
        }
    }

    @Override
    public int getSubscriberCount(Class<? extends DomainEvent> eventType) {
        List<Subscriber<?>> list = subscribers.get(eventType);
        return list == null ? 0 : list.size();
    }

    /**
     * Stops all asynchronous dispatchers, letting queued events finish for a short grace period.
     */
    @PreDestroy
    public void shutdown() {
        subscribers.values().forEach(list -> list.forEach(Subscriber::shutdown));
        subscribers.clear();
    }

    private final class Subscriber<E extends DomainEvent> {

        private final Class<E> eventType;
        private final Consumer<? super E> handler;
        private final ExecutorService executor;

        private Subscriber(Class<E> eventType, Consumer<? super E> handler, boolean async) {
            this.eventType = eventType;
            this.handler = handler;
            this.executor = async ? Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable,
                        "event-bus-" + eventType.getSimpleName() + "-" + THREAD_COUNTER.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }) : null;
        }

        private void dispatch(DomainEvent event) {
            E typed = eventType.cast(event);
            if (executor == null) {
                invoke(typed);
                return;
            }
            try {
                executor.execute(() -> invoke(typed));
            } catch (RejectedExecutionException e) {
                log.warn("Async subscriber is shut down, dropping event: type={}", eventType.getSimpleName());
            }
        }

        private void invoke(E event) {
            try {
                handler.accept(event);
            } catch (Exception e) {
                metrics.recordEventHandlerFailure(eventType.getSimpleName());
                log.error("Event handler failed: type={}, eventId={}, error={}",
                        eventType.getSimpleName(), event.getEventId(), e.getMessage(), e);
            }
        }

        private void shutdown() {
            if (executor == null) {
                return;
            }
            executor.shutdown();
            try {
                if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
