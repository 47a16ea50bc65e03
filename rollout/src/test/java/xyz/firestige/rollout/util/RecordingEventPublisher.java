package xyz.firestige.rollout.util;

import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.event.RolloutTransitionedEvent;
import xyz.firestige.rollout.domain.shared.event.DomainEventPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 记录发布的领域事件
 */
public class RecordingEventPublisher implements DomainEventPublisher {

    private final List<Object> publishedEvents = new CopyOnWriteArrayList<>();

    @Override
    public void publish(Object event) {
        publishedEvents.add(event);
    }

    public List<Object> getPublishedEvents() {
        return new ArrayList<>(publishedEvents);
    }

    /**
     * 获取指定类型的事件
     */
    public <T> List<T> getEventsOfType(Class<T> eventType) {
        return publishedEvents.stream()
                .filter(eventType::isInstance)
                .map(eventType::cast)
                .collect(Collectors.toList());
    }

    public <T> boolean hasEvent(Class<T> eventType) {
        return publishedEvents.stream().anyMatch(eventType::isInstance);
    }

    /**
     * 某个发布的状态转换原因码，按发布顺序
     */
    public List<ReasonCode> reasonCodesOf(String rolloutId) {
        return getEventsOfType(RolloutTransitionedEvent.class).stream()
                .filter(e -> rolloutId.equals(e.getRolloutId()))
                .map(RolloutTransitionedEvent::getReasonCode)
                .collect(Collectors.toList());
    }

    public void clear() {
        publishedEvents.clear();
    }
}
