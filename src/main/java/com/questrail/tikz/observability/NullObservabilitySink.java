package com.questrail.tikz.observability;

/**
 * No-op implementation of DiagramObservabilitySink.
 */
public final class NullObservabilitySink implements DiagramObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onParseAnomaly(ParseAnomalyEvent event) {}

    @Override
    public void onFallbackPlacement(FallbackPlacementEvent event) {}

    @Override
    public void onModelAnomaly(ModelAnomalyEvent event) {}

    @Override
    public void onRegeneration(RegenerationEvent event) {}
}
