package com.questrail.tikz.align;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All alignment candidates of one point, grouped by kind.
 *
 * <p>A node may appear under several kinds at once.</p>
 */
public final class AlignmentCandidates
{
    private final Map<AlignmentKind, List<AlignmentCandidate>> byKind = new EnumMap<>(AlignmentKind.class);

    AlignmentCandidates() {
        for (AlignmentKind kind : AlignmentKind.values()) {
            byKind.put(kind, new ArrayList<>());
        }
    }

    void add(AlignmentCandidate candidate) {
        byKind.get(candidate.kind()).add(candidate);
    }

    public List<AlignmentCandidate> of(AlignmentKind kind) {
        return Collections.unmodifiableList(byKind.get(kind));
    }

    public boolean isEmpty() {
        return byKind.values().stream().allMatch(List::isEmpty);
    }

    /**
     * The single closest candidate across all kinds. Ties are resolved by
     * {@link AlignmentKind} order, then by node encounter order.
     */
    public Optional<AlignmentCandidate> closest() {
        AlignmentCandidate best = null;
        for (AlignmentKind kind : AlignmentKind.values()) {
            for (AlignmentCandidate c : byKind.get(kind)) {
                if (best == null || c.distance() < best.distance()) {
                    best = c;
                }
            }
        }
        return Optional.ofNullable(best);
    }
}
