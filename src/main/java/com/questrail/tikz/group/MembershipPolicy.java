package com.questrail.tikz.group;

import com.questrail.tikz.model.Box;

/**
 * Rule deciding whether a node belongs to a group's explicitly sized box.
 *
 * <p>One policy is chosen per engine and applied everywhere membership is
 * derived from a box, so that a resize and a later regeneration never
 * disagree about who is inside.</p>
 */
public enum MembershipPolicy {
    /** The node's center lies inside the group box (edges inclusive). */
    CENTER_CONTAINED {
        @Override
        public boolean isMember(Box groupBox, Box nodeBox) {
            return groupBox.contains(nodeBox.center());
        }
    },
    /** The node's box touches or overlaps the group box. */
    INTERSECTING {
        @Override
        public boolean isMember(Box groupBox, Box nodeBox) {
            return groupBox.intersects(nodeBox);
        }
    };

    public abstract boolean isMember(Box groupBox, Box nodeBox);
}
