/**
 * Source Regeneration
 * =============================================================================
 *
 * <p>Turns a placed model back into diagram source.</p>
 *
 * <pre>
 *   DiagramModel
 *        → ExportClustering (canvas → cm, jitter removal)
 *        → safety check on the source text
 *        → StatementRewriter per statement   (round trip)
 *          or SyntheticSerializer            (from the model alone)
 * </pre>
 *
 * <p>Only {@link com.questrail.tikz.regen.impl.RoundTripRegenerator} is public.</p>
 */
package com.questrail.tikz.regen.impl;
