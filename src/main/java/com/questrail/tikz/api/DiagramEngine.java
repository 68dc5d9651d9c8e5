package com.questrail.tikz.api;

import com.questrail.tikz.model.Box;
import com.questrail.tikz.model.DiagramModel;

/**
 * DiagramEngine
 * -----------------------------------------------------------------------------
 * {@code DiagramEngine} is the command façade of the layout engine: it turns
 * diagram source into a placed {@link DiagramModel}, applies interactive edits
 * to that model, and turns the model back into source.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Parsing and resolving a whole document into a model in which every
 *       node has a coordinate</li>
 *   <li>Applying node moves, group resizes and group moves while keeping
 *       group boxes and memberships consistent</li>
 *   <li>Regenerating source that rewrites only position-bearing fragments of
 *       the original text</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Rendering, hit-testing or pointer input</li>
 *   <li>Viewport state such as zoom, pan or grid visibility</li>
 *   <li>Loading or saving documents</li>
 * </ul>
 *
 * <h2>Totality</h2>
 * Every command is total over well-typed arguments. Malformed source, dangling
 * references and unknown command targets are absorbed and reported through the
 * configured observability sink; nothing is thrown for them. {@code null}
 * arguments are programmer errors and fail fast.
 *
 * <h2>One Direction Per Command</h2>
 * A node move re-derives the boxes of the groups containing the node. A group
 * resize or group move re-derives that group's members from its box. No
 * command does both for the same group.
 *
 * <h2>Threading</h2>
 * Commands are synchronous and mutate the given model in place. Models are not
 * thread-safe; the caller serializes access.
 */
public interface DiagramEngine
{
    /**
     * Parses and resolves a whole document.
     *
     * @param source diagram source; {@code null} is treated as empty
     * @return a new model in which every node is placed
     */
    DiagramModel parse(String source);

    /**
     * Moves a node to {@code (x, y)} in canvas units. With grid snap on, the
     * point is snapped against the other nodes first. Groups containing the
     * node are re-fitted to their members.
     *
     * @return {@code model}
     */
    DiagramModel moveNode(DiagramModel model, String nodeName, double x, double y);

    /**
     * Gives a group an explicit box and recomputes its members from it. The
     * box is clamped to the minimum group extent.
     *
     * @return {@code model}
     */
    DiagramModel resizeGroup(DiagramModel model, String groupName, Box box);

    /**
     * Re-centers a group's box on {@code (x, y)} and recomputes its members
     * from the moved box.
     *
     * @return {@code model}
     */
    DiagramModel moveGroup(DiagramModel model, String groupName, double x, double y);

    /**
     * Switches grid snap for interactive moves and export precision.
     *
     * @return {@code model}
     */
    DiagramModel setGridSnap(DiagramModel model, boolean gridSnap);

    /**
     * Regenerates the model's source and parses it into a fresh model. The
     * grid-snap flag carries over.
     *
     * @return a new model
     */
    DiagramModel reparse(DiagramModel model);

    /**
     * Serializes the model, reusing its source text where it can be trusted.
     */
    String regenerate(DiagramModel model);
}
