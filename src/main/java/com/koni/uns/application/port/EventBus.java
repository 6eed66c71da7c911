package com.koni.uns.application.port;

import com.koni.uns.domain.event.DomainEvent;

import java.util.function.Consumer;

/**
 * Port for the in-process publish/subscribe fabric.
 * 
 * Guarantees:
 * - every current subscriber of the event's class receives it, in subscription order
 * - a subscriber may ask for asynchronous dispatch so that a slow handler never blocks publishers
 * - events published while nobody subscribes are dropped, nothing is persisted
 * - publishing never throws; handler failures are logged and do not stop delivery to others
 */
public interface EventBus {
    
    enum DispatchMode {
        SYNC,
        ASYNC
    }
    
    /**
     * Handle returned by subscribe; closing it removes the subscription.
     */
    interface Subscription extends AutoCloseable {
        
        @Override
        void close();
    }
    
    /**
     * Subscribes a handler invoked synchronously on the publishing thread.
     */
    <E extends DomainEvent> Subscription subscribe(Class<E> eventType, Consumer<? super E> handler);
    
    /**
     * Subscribes a handler with the given dispatch mode. Asynchronous handlers of a single
     * subscription run one at a time, in publish order.
     * 
     * @param eventType concrete event class to receive
     * @param handler the handler
     * @param mode synchronous or asynchronous dispatch
     * @return the subscription handle
     * @throws IllegalArgumentException if eventType or handler is null
     */
    <E extends DomainEvent> Subscription subscribe(Class<E> eventType, Consumer<? super E> handler, DispatchMode mode);
    
    /**
     * Delivers the event to all current subscribers of its class. Never throws.
     * 
     * @param event the event to publish
     */
    void publish(DomainEvent event);
    
    int getSubscriberCount(Class<? extends DomainEvent> eventType);
}
