package com.linlay.streamrunner.stream.source;

import com.linlay.streamrunner.stream.model.StreamEvent;
import reactor.core.publisher.Flux;

import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Lock-style source over a Reactor {@link Flux}. Opening acquires an exclusive read lock and
 * subscribes; closing cancels the subscription and releases the lock.
 */
public class FluxStreamSource implements StreamSource {

    private static final int PREFETCH = 32;

    private final Flux<StreamEvent> events;
    private final boolean replayable;
    private final AtomicBoolean locked = new AtomicBoolean(false);

    public FluxStreamSource(Flux<StreamEvent> events) {
        this(events, false);
    }

    /**
     * @param replayable {@code true} for cold publishers where every subscription starts over
     */
    public FluxStreamSource(Flux<StreamEvent> events, boolean replayable) {
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.replayable = replayable;
    }

    @Override
    public StreamReader open() {
        if (!locked.compareAndSet(false, true)) {
            throw new IllegalStateException("stream source is already locked by another reader");
        }
        Stream<StreamEvent> stream;
        try {
            stream = events.toStream(PREFETCH);
        } catch (RuntimeException ex) {
            locked.set(false);
            throw ex;
        }
        Iterator<StreamEvent> iterator = stream.iterator();
        AtomicBoolean released = new AtomicBoolean(false);
        return new StreamReader() {
            @Override
            public StreamEvent next() {
                return iterator.hasNext() ? iterator.next() : null;
            }

            @Override
            public void close() {
                if (released.compareAndSet(false, true)) {
                    try {
                        stream.close();
                    } finally {
                        locked.set(false);
                    }
                }
            }
        };
    }

    public boolean isLocked() {
        return locked.get();
    }

    @Override
    public boolean isReplayable() {
        return replayable;
    }
}
