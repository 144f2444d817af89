package dev.fairbid.client;

import com.google.protobuf.Any;
import com.google.protobuf.Internal;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import dev.fairbid.EventBook;
import dev.fairbid.EventPage;
import dev.fairbid.client.annotations.Applies;
import dev.fairbid.client.annotations.Handles;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.Map;

/**
 * Base class for event-sourced aggregates using the OO pattern.
 *
 * Subclasses must:
 * - Override getDomain()
 * - Override createEmptyState()
 * - Annotate command handlers with @Handles(CommandType.class)
 * - Annotate event appliers with @Applies(EventType.class)
 *
 * <p>Handlers and appliers are matched on the full protobuf name of their message type.
 * Prior events are replayed lazily on first access to the state; after that,
 * {@link #getEventBook()} only holds the events recorded by this instance.
 */
public abstract class Aggregate<S> {

    private static final ClassValue<Routes> ROUTES = new ClassValue<>() {
        @Override
        protected Routes computeValue(Class<?> type) {
            return Routes.scan(type);
        }
    };

    private final Routes routes;
    private EventBook eventBook;
    private S state;
    private int priorEvents;

    /**
     * The domain this aggregate belongs to.
     */
    public abstract String getDomain();

    /**
     * Create an empty state instance.
     */
    protected abstract S createEmptyState();

    protected Aggregate() {
        this(null);
    }

    protected Aggregate(EventBook history) {
        this.eventBook = history != null ? history : EventBook.getDefaultInstance();
        this.routes = ROUTES.get(getClass());
    }

    /**
     * Get the current state, replaying prior events on first access.
     */
    public S getState() {
        if (state == null) {
            S rebuilt = createEmptyState();
            for (EventPage page : eventBook.getPagesList()) {
                if (page.hasEvent()) {
                    applyEvent(rebuilt, page.getEvent());
                }
            }
            priorEvents = eventBook.getPagesCount();
            eventBook = EventBook.getDefaultInstance();
            state = rebuilt;
        }
        return state;
    }

    /**
     * Get the events recorded since the state was rebuilt.
     */
    public EventBook getEventBook() {
        return eventBook;
    }

    /**
     * Handle a command and return the resulting event.
     *
     * @param command The command message to handle
     * @return The resulting event message, already applied to the state
     * @throws Errors.CommandRejectedError if the handler rejects the command
     * @throws Errors.InvalidArgumentError if no handler accepts the command type
     */
    public Message handleCommand(Message command) {
        String typeName = command.getDescriptorForType().getFullName();
        Method handler = routes.handlers().get(typeName);
        if (handler == null) {
            throw new Errors.InvalidArgumentError("Unknown command: " + typeName);
        }

        getState();
        Object result = invoke(handler, "Handler for " + typeName, command);
        if (result instanceof Message event) {
            applyAndRecord(event);
            return event;
        }
        return null;
    }

    /**
     * Pack event, apply to cached state, add to event book.
     */
    protected void applyAndRecord(Message event) {
        S current = getState();
        Any packed = Helpers.packAny(event);
        applyEvent(current, packed);

        eventBook = eventBook.toBuilder()
            .addPages(EventPage.newBuilder()
                .setSequence(priorEvents + eventBook.getPagesCount())
                .setEvent(packed)
                .setCreatedAt(Helpers.now()))
            .build();
    }

    /**
     * Apply a single event to state.
     * Override to provide custom event dispatch instead of using @Applies annotations.
     */
    protected void applyEvent(S target, Any packed) {
        String typeName = Helpers.typeNameFromUrl(packed.getTypeUrl());
        Route applier = routes.appliers().get(typeName);
        if (applier == null) {
            // Unknown event type - newer writers may add events older readers skip
            return;
        }
        try {
            invoke(applier.method(), "Applier for " + typeName, target, packed.unpack(applier.messageType()));
        } catch (InvalidProtocolBufferException e) {
            throw new Errors.ClientError("Failed to unpack event " + typeName, e);
        }
    }

    private Object invoke(Method method, String what, Object... args) {
        try {
            return method.invoke(this, args);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new Errors.ClientError(what + " failed", e.getCause());
        } catch (IllegalAccessException e) {
            throw new Errors.ClientError(what + " is not accessible", e);
        }
    }

    private record Route(Method method, Class<? extends Message> messageType) {}

    private record Routes(Map<String, Method> handlers, Map<String, Route> appliers) {

        static Routes scan(Class<?> type) {
            var handlers = new HashMap<String, Method>();
            var appliers = new HashMap<String, Route>();
            for (Method method : type.getMethods()) {
                Handles handles = method.getAnnotation(Handles.class);
                if (handles != null) {
                    handlers.put(fullName(handles.value()), method);
                }
                Applies applies = method.getAnnotation(Applies.class);
                if (applies != null) {
                    appliers.put(fullName(applies.value()), new Route(method, applies.value()));
                }
            }
            return new Routes(Map.copyOf(handlers), Map.copyOf(appliers));
        }

        private static String fullName(Class<? extends Message> messageType) {
            return Internal.getDefaultInstance(messageType).getDescriptorForType().getFullName();
        }
    }
}
