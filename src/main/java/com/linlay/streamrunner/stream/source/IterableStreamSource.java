package com.linlay.streamrunner.stream.source;

import com.linlay.streamrunner.stream.model.StreamEvent;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Iterator-style source: each reader walks its own iterator. Replayable when backed by a
 * collection.
 */
public class IterableStreamSource implements StreamSource {

    private final Iterable<StreamEvent> events;

    public IterableStreamSource(Iterable<StreamEvent> events) {
        this.events = Objects.requireNonNull(events, "events must not be null");
    }

    public static IterableStreamSource of(StreamEvent... events) {
        return new IterableStreamSource(List.of(events));
    }

    @Override
    public StreamReader open() {
        Iterator<StreamEvent> iterator = events.iterator();
        return new StreamReader() {
            @Override
            public StreamEvent next() {
                return iterator.hasNext() ? iterator.next() : null;
            }

            @Override
            public void close() {
                // nothing held
            }
        };
    }

    @Override
    public boolean isReplayable() {
        return events instanceof Collection<?>;
    }
}
