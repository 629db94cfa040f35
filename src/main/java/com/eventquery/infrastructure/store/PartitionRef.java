package com.eventquery.infrastructure.store;

import com.eventquery.domain.model.EventKind;
import lombok.Value;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * Identity of one (event kind, day) partition.
 *
 * Natural order is the canonical visiting order: day ascending, then kind name.
 */
@Value
public class PartitionRef implements Comparable<PartitionRef> {

    private static final Comparator<PartitionRef> CANONICAL_ORDER = Comparator
            .comparing(PartitionRef::getDay)
            .thenComparing(ref -> ref.getKind().wireName());

    EventKind kind;
    LocalDate day;

    @Override
    public int compareTo(PartitionRef other) {
        return CANONICAL_ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "type=" + kind.wireName() + "/day=" + day;
    }
}
