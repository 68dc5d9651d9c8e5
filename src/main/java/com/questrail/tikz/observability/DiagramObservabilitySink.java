package com.questrail.tikz.observability;

/**
 * Receives the anomalies the engine absorbs instead of throwing.
 *
 * <p>Nothing reported here is an error for the caller: every event describes
 * input that was skipped, dropped, placed by a fallback, or output that was
 * degraded. Implementations can provide logging, metrics, or diagnostics.</p>
 */
public interface DiagramObservabilitySink {
    /**
     * Called when a source fragment could not be recognized and was skipped.
     * @param event the skipped fragment
     */
    void onParseAnomaly(ParseAnomalyEvent event);

    /**
     * Called when a node could only be placed by one of the fallback tiers.
     * @param event the placement
     */
    void onFallbackPlacement(FallbackPlacementEvent event);

    /**
     * Called when the model had to drop or ignore something (duplicate node,
     * dangling connector, group without members, unknown command target).
     * @param event the anomaly
     */
    void onModelAnomaly(ModelAnomalyEvent event);

    /**
     * Called once per regeneration with the mode that was used.
     * @param event the regeneration outcome
     */
    void onRegeneration(RegenerationEvent event);
}
