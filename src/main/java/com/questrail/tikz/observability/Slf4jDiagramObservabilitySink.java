package com.questrail.tikz.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DiagramObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jDiagramObservabilitySink implements DiagramObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDiagramObservabilitySink.class);

    @Override
    public void onParseAnomaly(ParseAnomalyEvent event) {
        log.debug("Skipped fragment at offset {}: {} ({})",
            event.offset(), event.fragment(), event.reason());
    }

    @Override
    public void onFallbackPlacement(FallbackPlacementEvent event) {
        log.info("Node '{}' placed by {} at ({}, {})",
            event.nodeName(),
            event.tier(),
            event.placedAt().x(),
            event.placedAt().y());
    }

    @Override
    public void onModelAnomaly(ModelAnomalyEvent event) {
        log.info("{} '{}': {}", event.kind(), event.subject(), event.detail());
    }

    @Override
    public void onRegeneration(RegenerationEvent event) {
        if (event.isDegraded()) {
            log.warn("Round-trip regeneration abandoned, synthesizing: {}", event.reason());
        } else {
            log.debug("Regenerated in {} mode", event.mode());
        }
    }
}
