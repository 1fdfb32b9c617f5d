/*
 * Copyright (c) 2025 DevSquad Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.devsquad.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.devsquad.core.capabilities.CapabilityRegistry;
import io.devsquad.core.events.inbound.InboundEvent;
import io.devsquad.core.events.inbound.InboundEventParser;
import io.devsquad.core.events.outbound.OutboundEvent;
import io.devsquad.core.events.outbound.OutboundEventSerializer;
import io.devsquad.core.model.AgentIdentity;
import io.devsquad.core.response.ResponseProvider;
import io.devsquad.core.response.SafeResponseProvider;
import io.devsquad.core.threads.ThreadStateTracker;
import io.devsquad.core.transport.CoordinationTransport;
import io.devsquad.core.utils.AgentUtils;
import io.devsquad.core.utils.JsonUtils;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Owns the single stream of one agent to the coordination server. Turns raw lines into {@link InboundEvent}s,
 * dispatches them and delivers the replies.
 * <p>
 * An engine is single use. Once {@link EngineState#CLOSED} it must be replaced, not reconnected. Events are
 * handled one at a time in the order they arrive.
 */
@Slf4j
public class ProtocolEngine implements AutoCloseable {
    @Getter
    private final AgentIdentity identity;
    private final CoordinationTransport transport;
    @Getter
    private final CapabilityRegistry registry;
    @Getter
    private final ThreadStateTracker threadStateTracker;
    private final InboundEventParser parser;
    private final OutboundEventSerializer serializer;
    private final EventDispatcher dispatcher;

    private final AtomicReference<EngineState> state = new AtomicReference<>(EngineState.DISCONNECTED);
    private final AtomicReference<Stream<String>> lines = new AtomicReference<>();
    private final AtomicBoolean eventsTaken = new AtomicBoolean(false);

    @Builder
    public ProtocolEngine(
            @NonNull AgentIdentity identity,
            @NonNull CoordinationTransport transport,
            CapabilityRegistry registry,
            @NonNull ResponseProvider responseProvider,
            ResponseProvider fallbackProvider,
            ThreadStateTracker threadStateTracker,
            ObjectMapper mapper) {
        this.identity = identity;
        this.transport = transport;
        this.registry = Objects.requireNonNullElseGet(registry, CapabilityRegistry::empty);
        this.threadStateTracker = Objects.requireNonNullElseGet(threadStateTracker, ThreadStateTracker::new);
        final var objectMapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.parser = new InboundEventParser(objectMapper);
        this.serializer = new OutboundEventSerializer(objectMapper);
        final ResponseProvider fallback = null != fallbackProvider ? fallbackProvider : (prompt, context) -> "";
        final var safeProvider = responseProvider instanceof SafeResponseProvider
                                 ? responseProvider
                                 : new SafeResponseProvider(responseProvider, fallback);
        this.dispatcher = new EventDispatcher(identity, this.registry, safeProvider, this.threadStateTracker);
    }

    public EngineState state() {
        return state.get();
    }

    /**
     * Opens the stream. On failure the engine goes back to {@link EngineState#DISCONNECTED} and the caller
     * decides whether to try again.
     *
     * @return true if the engine is now connected
     * @throws IllegalStateException if the engine is already connected or has been closed
     */
    public boolean connect() {
        if (!state.compareAndSet(EngineState.DISCONNECTED, EngineState.CONNECTING)) {
            throw new IllegalStateException("Engine for " + identity.getId() + " cannot connect from state "
                                                    + state.get());
        }
        final Optional<Stream<String>> opened;
        try {
            opened = transport.openStream(identity);
        }
        catch (RuntimeException e) {
            log.error("Error opening stream for {}: {}", identity.getId(), AgentUtils.rootCauseMessage(e));
            state.compareAndSet(EngineState.CONNECTING, EngineState.DISCONNECTED);
            return false;
        }
        if (opened.isEmpty()) {
            state.compareAndSet(EngineState.CONNECTING, EngineState.DISCONNECTED);
            return false;
        }
        lines.set(opened.get());
        if (!state.compareAndSet(EngineState.CONNECTING, EngineState.CONNECTED)) {
            //Closed while connecting
            opened.get().close();
            return false;
        }
        log.info("Agent {} connected", identity.getId());
        return true;
    }

    /**
     * Lazy sequence of inbound events. Unparseable lines are skipped. The sequence ends when the stream ends,
     * at which point the engine is {@link EngineState#CLOSED}. Can be obtained only once.
     *
     * @throws IllegalStateException if the engine is not connected or the events were already taken
     */
    public Stream<InboundEvent> events() {
        final var source = lines.get();
        if (state.get() != EngineState.CONNECTED || null == source) {
            throw new IllegalStateException("Engine for " + identity.getId() + " is not connected");
        }
        if (!eventsTaken.compareAndSet(false, true)) {
            throw new IllegalStateException("Events for " + identity.getId() + " have already been consumed");
        }
        return eventStream(source);
    }

    /**
     * Handles one event and delivers the reply, if any.
     *
     * @return The reply that was produced
     */
    public Optional<OutboundEvent> dispatch(final InboundEvent event) {
        log.debug("Dispatching {} event", event.getType());
        final var reply = event.accept(dispatcher);
        reply.ifPresent(this::deliver);
        return reply;
    }

    /**
     * Serializes and sends an event. Failures are logged and not retried.
     *
     * @return true if the server accepted the event
     */
    public boolean deliver(final OutboundEvent event) {
        final String payload;
        try {
            payload = serializer.serialize(event);
        }
        catch (IllegalStateException e) {
            log.error("Dropping {} event: {}", event.getType(), AgentUtils.rootCauseMessage(e));
            return false;
        }
        final var delivered = transport.deliver(payload);
        if (!delivered) {
            log.warn("Delivery of {} event failed", event.getType());
        }
        return delivered;
    }

    /**
     * Connects and processes events until the stream ends or the engine is closed.
     *
     * @return false if the stream could not be opened
     */
    public boolean run() {
        if (!connect()) {
            return false;
        }
        if (!eventsTaken.compareAndSet(false, true)) {
            throw new IllegalStateException("Events for " + identity.getId() + " have already been consumed");
        }
        final var source = lines.get();
        if (null != source) {
            //Source is null only if the engine was closed right after connecting
            try (final var events = eventStream(source)) {
                events.forEach(this::dispatch);
            }
        }
        log.info("Event loop for {} finished", identity.getId());
        return true;
    }

    /**
     * Closes the stream, ending the event sequence. Safe to call from any thread, any number of times.
     */
    @Override
    public void close() {
        final var previous = state.getAndSet(EngineState.CLOSED);
        final var source = lines.getAndSet(null);
        if (null != source) {
            try {
                source.close();
            }
            catch (RuntimeException e) {
                log.debug("Error closing stream for {}: {}", identity.getId(), AgentUtils.rootCauseMessage(e));
            }
        }
        if (previous != EngineState.CLOSED) {
            log.info("Engine for {} closed", identity.getId());
        }
    }

    private Stream<InboundEvent> eventStream(Stream<String> source) {
        return StreamSupport.stream(new EventSpliterator(source), false)
                .onClose(this::close);
    }

    private final class EventSpliterator extends Spliterators.AbstractSpliterator<InboundEvent> {
        private final Stream<String> lines;
        private Iterator<String> source;

        private EventSpliterator(Stream<String> lines) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.lines = lines;
        }

        @Override
        public boolean tryAdvance(Consumer<? super InboundEvent> action) {
            while (state.get() == EngineState.CONNECTED) {
                final String line;
                try {
                    if (null == source) {
                        source = lines.iterator();
                    }
                    if (!source.hasNext()) {
                        break;
                    }
                    line = source.next();
                }
                catch (RuntimeException e) {
                    log.warn("Stream for {} failed: {}", identity.getId(), AgentUtils.rootCauseMessage(e));
                    break;
                }
                final var event = parser.parse(line);
                if (event.isPresent()) {
                    action.accept(event.get());
                    return true;
                }
            }
            close();
            return false;
        }
    }
}
