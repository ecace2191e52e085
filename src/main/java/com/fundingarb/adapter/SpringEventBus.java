package com.fundingarb.adapter;

import com.fundingarb.event.DomainEvent;
import com.fundingarb.port.EventBusPort;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * {@link EventBusPort} on top of Spring's {@link ApplicationEventPublisher}.
 *
 * <p>Published events reach Spring {@code @EventListener} methods as usual, and this bean also
 * listens for every {@link DomainEvent} to fan it out to handlers registered through
 * {@link #subscribe}. A failing handler is logged and does not stop delivery to the others.
 */
@Component
public class SpringEventBus implements EventBusPort {

    private static final Logger log = LoggerFactory.getLogger(SpringEventBus.class);

    private final ApplicationEventPublisher applicationEventPublisher;
    private final List<Subscription<?>> subscriptions = new CopyOnWriteArrayList<>();

    public SpringEventBus(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(DomainEvent event) {
        log.debug("Publishing {} for symbol={} trade={}", event.getEventType(), event.getSymbol(), event.getTradeId());
        applicationEventPublisher.publishEvent(event);
    }

    @Override
    public <T extends DomainEvent> void subscribe(Class<T> eventType, Consumer<? super T> handler) {
        subscriptions.add(new Subscription<>(eventType, handler));
    }

    @EventListener
    public void onDomainEvent(DomainEvent event) {
        for (Subscription<?> subscription : subscriptions) {
            subscription.deliver(event);
        }
    }

    private static final class Subscription<T extends DomainEvent> {

        private final Class<T> eventType;
        private final Consumer<? super T> handler;

        private Subscription(Class<T> eventType, Consumer<? super T> handler) {
            this.eventType = eventType;
            this.handler = handler;
        }

        void deliver(DomainEvent event) {
            if (!eventType.isInstance(event)) {
                return;
            }
            try {
                handler.accept(eventType.cast(event));
            } catch (RuntimeException e) {
                log.error("Subscriber for {} failed on {}: {}", eventType.getSimpleName(), event.getEventType(),
                        e.getMessage(), e);
            }
        }
    }
}
