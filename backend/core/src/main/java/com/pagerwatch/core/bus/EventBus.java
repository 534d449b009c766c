package com.pagerwatch.core.bus;

import com.pagerwatch.core.events.PipelineEvent;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process diagnostics channel. Handlers run synchronously on the publishing thread, so they
 * must stay cheap: the ingestion loop publishes here between alerts.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends PipelineEvent>, CopyOnWriteArrayList<Consumer<? extends PipelineEvent>>> handlers =
            new ConcurrentHashMap<>();
    private final BiConsumer<PipelineEvent, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Pipeline event handler failed for type " + event.type(), ex));
    }

    public EventBus(BiConsumer<PipelineEvent, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends PipelineEvent> void subscribe(Class<T> type, Consumer<T> handler) {
        handlers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void publish(PipelineEvent event) {
        List<Consumer<? extends PipelineEvent>> registered = handlers.get(event.getClass());
        if (registered == null) {
            return;
        }
        for (Consumer<? extends PipelineEvent> rawHandler : registered) {
            invokeHandler(rawHandler, event, onHandlerError);
        }
    }

    public int handlerCount(Class<? extends PipelineEvent> type) {
        List<Consumer<? extends PipelineEvent>> registered = handlers.get(type);
        return registered == null ? 0 : registered.size();
    }

    @SuppressWarnings("unchecked")
    private static <T extends PipelineEvent> void invokeHandler(
            Consumer<? extends PipelineEvent> rawHandler,
            PipelineEvent event,
            BiConsumer<PipelineEvent, Exception> onHandlerError
    ) {
        try {
            Consumer<T> typedHandler = (Consumer<T>) rawHandler;
            typedHandler.accept((T) event);
        } catch (Exception ex) {
            onHandlerError.accept(event, ex);
        }
    }
}
