package com.fundingarb.port;

import com.fundingarb.event.DomainEvent;
import java.util.function.Consumer;

/** In-process pub/sub. Every local subscriber of a matching type receives each published event. */
public interface EventBusPort {

    void publish(DomainEvent event);

    <T extends DomainEvent> void subscribe(Class<T> eventType, Consumer<? super T> handler);
}
