package com.questrail.tikz.observability;

/**
 * A source fragment the parser skipped.
 *
 * @param offset   character offset in the source where the fragment starts
 * @param fragment a short excerpt of the fragment
 * @param reason   why it was skipped
 */
public record ParseAnomalyEvent(int offset, String fragment, String reason) {
}
