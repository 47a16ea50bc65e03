package xyz.firestige.rollout.infrastructure.event;

import org.springframework.context.ApplicationEventPublisher;
import xyz.firestige.rollout.domain.shared.event.DomainEventPublisher;

import java.util.List;

/**
 * Spring 本地事件总线实现（进程内事件传递）
 */
public class SpringDomainEventPublisher implements DomainEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(Object event) {
        if (event != null) {
            applicationEventPublisher.publishEvent(event);
        }
    }

    @Override
    public void publishAll(List<?> events) {
        if (events != null && !events.isEmpty()) {
            events.forEach(this::publish);
        }
    }
}
