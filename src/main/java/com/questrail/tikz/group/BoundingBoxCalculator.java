package com.questrail.tikz.group;

import com.questrail.tikz.config.LayoutPolicy;
import com.questrail.tikz.model.Box;
import com.questrail.tikz.model.DiagramModel;
import com.questrail.tikz.model.GroupRecord;
import com.questrail.tikz.model.NodeRecord;
import com.questrail.tikz.model.Point;
import com.questrail.tikz.observability.DiagramObservabilitySink;
import com.questrail.tikz.observability.ModelAnomalyEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * BoundingBoxCalculator
 * -----------------------------------------------------------------------------
 * Keeps a group's member list and its box consistent.
 *
 * <p>The binding runs in exactly one direction per command:</p>
 * <ul>
 *   <li>a node move derives the box from the members
 *       ({@link #recomputeFromMembers});</li>
 *   <li>an explicit resize or group move derives the members from the box
 *       ({@link #recomputeMembershipFromBox}).</li>
 * </ul>
 *
 * <p>Neither method calls the other, so a command can never oscillate
 * between the two.</p>
 */
public final class BoundingBoxCalculator
{
    private final LayoutPolicy layout;
    private final MembershipPolicy membership;
    private final DiagramObservabilitySink sink;

    public BoundingBoxCalculator(LayoutPolicy layout, MembershipPolicy membership, DiagramObservabilitySink sink) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.membership = Objects.requireNonNull(membership, "membership");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Sets the group box to the union of its placed members' boxes, expanded
     * by the group padding on every side.
     *
     * @return the new box, or empty if no member is placed (the box is then left unchanged)
     */
    public Optional<Box> recomputeFromMembers(DiagramModel model, GroupRecord group) {
        Box union = null;
        for (String name : group.members()) {
            Optional<NodeRecord> node = model.node(name).filter(NodeRecord::isResolved);
            if (node.isEmpty()) {
                continue;
            }
            union = union == null ? node.get().box() : union.union(node.get().box());
        }
        if (union == null) {
            return Optional.empty();
        }
        Box box = union.expand(layout.toCanvasLength(group.paddingCm()));
        group.setBox(box);
        return Optional.of(box);
    }

    /**
     * Replaces the member list with the placed nodes the membership policy
     * accepts for the current box, in declaration order.
     *
     * @throws IllegalStateException if the group has no box
     */
    public List<String> recomputeMembershipFromBox(DiagramModel model, GroupRecord group) {
        Box box = group.box().orElseThrow(() ->
                new IllegalStateException("Group '" + group.name() + "' has no box"));

        List<String> members = new ArrayList<>();
        for (NodeRecord node : model.resolvedNodes()) {
            if (membership.isMember(box, node.box())) {
                members.add(node.name());
            }
        }
        group.replaceMembers(members);
        return members;
    }

    /**
     * Derives the box of every group from its members. Groups none of whose
     * members exist are dropped from the model and reported.
     */
    public void initialize(DiagramModel model) {
        for (GroupRecord group : List.copyOf(model.groups())) {
            if (recomputeFromMembers(model, group).isEmpty()) {
                model.removeGroup(group.name());
                sink.onModelAnomaly(new ModelAnomalyEvent(
                        ModelAnomalyEvent.Kind.EMPTY_GROUP, group.name(),
                        "no declared member " + group.members() + " exists"));
            }
        }
    }

    /** Recomputes every group that has {@code nodeName} as a member. */
    public void onNodeMoved(DiagramModel model, String nodeName) {
        for (GroupRecord group : model.groups()) {
            if (group.hasMember(nodeName)) {
                recomputeFromMembers(model, group);
            }
        }
    }

    /**
     * Applies an explicit resize. Width and height are clamped to the
     * minimum group extent before membership is recomputed.
     */
    public void resize(DiagramModel model, GroupRecord group, Box requested) {
        double min = layout.minGroupExtent();
        Box clamped = new Box(requested.center(),
                Math.max(min, requested.width()),
                Math.max(min, requested.height()));
        group.setBox(clamped);
        recomputeMembershipFromBox(model, group);
    }

    /**
     * Translates the box so that it is centered on {@code newCenter} and
     * recomputes membership. The box is not re-derived from the new members.
     */
    public void move(DiagramModel model, GroupRecord group, Point newCenter) {
        Box current = group.box().orElseThrow(() ->
                new IllegalStateException("Group '" + group.name() + "' has no box"));
        group.setBox(current.moveTo(newCenter));
        recomputeMembershipFromBox(model, group);
    }
}
