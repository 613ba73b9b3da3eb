package com.witty.infrastructure.provenance;

import com.witty.domain.formalize.model.EventKind;
import com.witty.domain.formalize.model.OriginSpan;
import com.witty.domain.formalize.model.ProvenanceEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only event collector for one stage execution. Not shared between stages or requests.
 */
public class StageEventLog {

    private final RequestClock clock;
    private final List<ProvenanceEvent> events = new ArrayList<>();

    public StageEventLog(RequestClock clock) {
        this.clock = clock;
    }

    public Instant mark() {
        return clock.now();
    }

    public ProvenanceEvent record(EventKind kind, String detail) {
        ProvenanceEvent event = ProvenanceEvent.of(clock.now(), kind, detail);
        events.add(event);
        return event;
    }

    public ProvenanceEvent recordSince(Instant start, EventKind kind, String detail) {
        long duration = clock.millisSince(start);
        ProvenanceEvent event = ProvenanceEvent.timed(start, kind, detail, duration);
        events.add(event);
        return event;
    }

    public ProvenanceEvent recordExcerpt(EventKind kind, String detail, String excerpt, OriginSpan span) {
        ProvenanceEvent event = ProvenanceEvent.of(clock.now(), kind, detail).withExcerpt(excerpt, span);
        events.add(event);
        return event;
    }

    public long count(EventKind kind) {
        return events.stream().filter(e -> e.kind() == kind).count();
    }

    public List<ProvenanceEvent> events() {
        return List.copyOf(events);
    }
}
