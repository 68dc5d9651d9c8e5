package com.questrail.tikz.group;

import com.questrail.tikz.config.LayoutPolicy;
import com.questrail.tikz.model.Box;
import com.questrail.tikz.model.DiagramModel;
import com.questrail.tikz.model.GroupRecord;
import com.questrail.tikz.model.NodeRecord;
import com.questrail.tikz.model.Point;
import com.questrail.tikz.model.PositionSpec;
import com.questrail.tikz.model.ResolutionTier;
import com.questrail.tikz.model.ShapeCategory;
import com.questrail.tikz.observability.ModelAnomalyEvent;
import com.questrail.tikz.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BoundingBoxCalculatorTest
{
    private final LayoutPolicy layout = LayoutPolicy.defaults();
    private RecordingObservabilitySink sink;
    private DiagramModel model;
    private GroupRecord group;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        model = new DiagramModel("");
        model.addNode(placed("a", 100, 100));
        model.addNode(placed("b", 300, 200));
        group = new GroupRecord("g", "group", "G", List.of("a", "b"), 0.3);
        model.addGroup(group);
    }

    private static NodeRecord placed(String name, double x, double y) {
        NodeRecord n = new NodeRecord(name, "service", ShapeCategory.DEFAULT_RECTANGLE,
                PositionSpec.none(""), name, name);
        n.place(new Point(x, y), ResolutionTier.ABSOLUTE);
        return n;
    }

    private BoundingBoxCalculator calculator(MembershipPolicy policy) {
        return new BoundingBoxCalculator(layout, policy, sink);
    }

    // ---------------------------------------------------------------------
    // Members -> box
    // ---------------------------------------------------------------------

    /**
     * Verifies that the box is the union of the member boxes expanded by the
     * padding on every side.
     */
    @Test
    void boxIsPaddedUnionOfMembers() {
        Box box = calculator(MembershipPolicy.CENTER_CONTAINED)
                .recomputeFromMembers(model, group).orElseThrow();

        assertEquals(new Point(200, 150), box.center());
        assertEquals(350, box.width(), 1e-9);
        assertEquals(180, box.height(), 1e-9);
        assertEquals(box, group.box().orElseThrow());
        for (String member : group.members()) {
            assertTrue(box.contains(model.node(member).orElseThrow().box()));
        }
    }

    @Test
    void unplacedMembersDoNotContribute() {
        model.addNode(new NodeRecord("c", "service", ShapeCategory.DEFAULT_RECTANGLE,
                PositionSpec.none(""), "c", "c"));
        GroupRecord partial = new GroupRecord("p", "", "", List.of("a", "c"), 0);
        model.addGroup(partial);

        Box box = calculator(MembershipPolicy.CENTER_CONTAINED)
                .recomputeFromMembers(model, partial).orElseThrow();

        assertEquals(model.node("a").orElseThrow().box(), box);
    }

    @Test
    void nodeMoveRecomputesOwningGroup() {
        BoundingBoxCalculator calc = calculator(MembershipPolicy.CENTER_CONTAINED);
        calc.initialize(model);

        model.node("a").orElseThrow().moveTo(new Point(100, 300));
        calc.onNodeMoved(model, "a");

        Box box = group.box().orElseThrow();
        assertEquals(new Point(200, 250), box.center());
        assertEquals(350, box.width(), 1e-9);
        assertEquals(List.of("a", "b"), group.members());
    }

    @Test
    void initializeDropsGroupWithoutExistingMembers() {
        model.addGroup(new GroupRecord("ghosts", "", "", List.of("x"), 0.3));

        calculator(MembershipPolicy.CENTER_CONTAINED).initialize(model);

        assertTrue(model.group("ghosts").isEmpty());
        assertTrue(model.group("g").isPresent());
        List<ModelAnomalyEvent> events = sink.modelAnomalies(ModelAnomalyEvent.Kind.EMPTY_GROUP);
        assertEquals(1, events.size());
        assertEquals("ghosts", events.get(0).subject());
    }

    // ---------------------------------------------------------------------
    // Box -> members
    // ---------------------------------------------------------------------

    /**
     * Verifies that an explicit resize re-derives membership under the
     * configured policy and leaves the requested box in place.
     */
    @Test
    void resizeRecomputesMembershipPerPolicy() {
        Box requested = new Box(new Point(200, 150), 100, 100);

        calculator(MembershipPolicy.CENTER_CONTAINED).resize(model, group, requested);
        assertEquals(List.of(), group.members());
        assertEquals(requested, group.box().orElseThrow());

        calculator(MembershipPolicy.INTERSECTING).resize(model, group, requested);
        assertEquals(List.of("a", "b"), group.members());

        calculator(MembershipPolicy.CENTER_CONTAINED)
                .resize(model, group, new Box(new Point(120, 110), 100, 100));
        assertEquals(List.of("a"), group.members());
    }

    @Test
    void resizeClampsToMinimumExtent() {
        calculator(MembershipPolicy.CENTER_CONTAINED)
                .resize(model, group, new Box(new Point(100, 100), 5, 0));

        Box box = group.box().orElseThrow();
        assertEquals(layout.minGroupExtent(), box.width(), 1e-9);
        assertEquals(layout.minGroupExtent(), box.height(), 1e-9);
        assertEquals(List.of("a"), group.members());
    }

    @Test
    void moveKeepsExtentAndRecomputesMembership() {
        BoundingBoxCalculator calc = calculator(MembershipPolicy.CENTER_CONTAINED);
        calc.initialize(model);

        calc.move(model, group, new Point(100, 100));

        Box box = group.box().orElseThrow();
        assertEquals(new Point(100, 100), box.center());
        assertEquals(350, box.width(), 1e-9);
        assertEquals(180, box.height(), 1e-9);
        assertEquals(List.of("a"), group.members());
    }

    @Test
    void membershipFromBoxRequiresBox() {
        assertThrows(IllegalStateException.class,
                () -> calculator(MembershipPolicy.CENTER_CONTAINED).recomputeMembershipFromBox(model, group));
    }
}
