package com.questrail.tikz.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * GroupRecord
 * -----------------------------------------------------------------------------
 * A named background region fitted around a set of member nodes.
 *
 * <p>Membership and bounding box are bound in both directions by
 * {@link com.questrail.tikz.group.BoundingBoxCalculator}; this class only
 * stores them. The style clause and label are kept opaque for regeneration.</p>
 */
public final class GroupRecord
{
    private final String name;
    private final String styleClause;
    private final String label;
    private final double paddingCm;

    private final List<String> members;
    private Box box;

    public GroupRecord(String name,
                       String styleClause,
                       String label,
                       Collection<String> members,
                       double paddingCm) {
        this.name = Objects.requireNonNull(name, "name");
        this.styleClause = styleClause == null ? "" : styleClause;
        this.label = label == null ? "" : label;
        if (paddingCm < 0) {
            throw new IllegalArgumentException("paddingCm must be non-negative");
        }
        this.paddingCm = paddingCm;
        this.members = new ArrayList<>(new LinkedHashSet<>(Objects.requireNonNull(members, "members")));
    }

    public String name() {
        return name;
    }

    public String styleClause() {
        return styleClause;
    }

    public String label() {
        return label;
    }

    public double paddingCm() {
        return paddingCm;
    }

    /**
     * Current member names, in order. The returned list is a snapshot.
     */
    public List<String> members() {
        return List.copyOf(members);
    }

    public boolean hasMember(String nodeName) {
        return members.contains(nodeName);
    }

    public void replaceMembers(Collection<String> newMembers) {
        members.clear();
        members.addAll(new LinkedHashSet<>(newMembers));
    }

    public Optional<Box> box() {
        return Optional.ofNullable(box);
    }

    public void setBox(Box newBox) {
        this.box = Objects.requireNonNull(newBox, "newBox");
    }

    @Override
    public String toString() {
        return "GroupRecord[" + name + ", members=" + members + ", box=" + box + "]";
    }
}
