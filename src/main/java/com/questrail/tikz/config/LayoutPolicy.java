package com.questrail.tikz.config;

import com.questrail.tikz.model.Direction;
import com.questrail.tikz.model.DocumentPoint;
import com.questrail.tikz.model.Point;

import java.util.Objects;

/**
 * LayoutPolicy
 * -----------------------------------------------------------------------------
 * Every geometric constant used by resolution, alignment, grouping and export.
 *
 * <p>The defaults are layout heuristics tuned on typical architecture
 * diagrams.</p>
 *
 * <h2>Units</h2>
 * <ul>
 *   <li>Parameters suffixed {@code Cm} are document units (centimetres,
 *       y axis up).</li>
 *   <li>All other lengths are canvas units (y axis down).</li>
 * </ul>
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>pixelsPerCm</b>, <b>documentOrigin</b>: conversion between document
 *       and canvas units; the document origin sits at {@code documentOrigin}
 *       on the canvas.</li>
 *   <li><b>gridSize</b>: base grid quantum every snap rounds to.</li>
 *   <li><b>alignmentThreshold</b>: distance under which another node counts
 *       as a row/column/diagonal alignment candidate. Must not exceed half the
 *       grid size, otherwise snapping stops being idempotent.</li>
 *   <li><b>shiftAboveCm</b>, <b>shiftBelowCm</b>, <b>shiftLeftCm</b>,
 *       <b>shiftRightCm</b>: default distance of a relative placement when
 *       no explicit shift is declared.</li>
 *   <li><b>maxResolutionPasses</b>, <b>maxFallbackPasses</b>: iteration caps
 *       that bound resolution on cyclic or malformed input.</li>
 *   <li><b>connectorOffset</b>: offset from a connector's source used by the
 *       connector-inference fallback.</li>
 *   <li><b>gridColumns</b>, <b>gridOrigin</b>, <b>gridCellWidth</b>,
 *       <b>gridCellHeight</b>: the last-resort grid layout.</li>
 *   <li><b>defaultPaddingCm</b>: group padding when {@code inner sep} is not
 *       declared.</li>
 *   <li><b>minGroupExtent</b>: smallest width/height an explicit resize may
 *       produce.</li>
 *   <li><b>exportClusterToleranceCm</b>, <b>exportQuantumCm</b>: export
 *       clustering tolerance and the rounding quantum used outside snap
 *       mode.</li>
 *   <li><b>unmatchedCoordinate</b>: position written for declarations that
 *       never parsed and match no resolved node.</li>
 * </ul>
 */
public record LayoutPolicy(
        double pixelsPerCm,
        Point documentOrigin,
        double gridSize,
        double alignmentThreshold,
        double shiftAboveCm,
        double shiftBelowCm,
        double shiftLeftCm,
        double shiftRightCm,
        int maxResolutionPasses,
        int maxFallbackPasses,
        Point connectorOffset,
        int gridColumns,
        Point gridOrigin,
        double gridCellWidth,
        double gridCellHeight,
        double defaultPaddingCm,
        double minGroupExtent,
        double exportClusterToleranceCm,
        double exportQuantumCm,
        DocumentPoint unmatchedCoordinate
) {
    public LayoutPolicy {
        Objects.requireNonNull(documentOrigin, "documentOrigin");
        Objects.requireNonNull(connectorOffset, "connectorOffset");
        Objects.requireNonNull(gridOrigin, "gridOrigin");
        Objects.requireNonNull(unmatchedCoordinate, "unmatchedCoordinate");

        requirePositive(pixelsPerCm, "pixelsPerCm");
        requirePositive(gridSize, "gridSize");
        requirePositive(gridCellWidth, "gridCellWidth");
        requirePositive(gridCellHeight, "gridCellHeight");
        requirePositive(exportQuantumCm, "exportQuantumCm");
        requireNonNegative(alignmentThreshold, "alignmentThreshold");
        requireNonNegative(shiftAboveCm, "shiftAboveCm");
        requireNonNegative(shiftBelowCm, "shiftBelowCm");
        requireNonNegative(shiftLeftCm, "shiftLeftCm");
        requireNonNegative(shiftRightCm, "shiftRightCm");
        requireNonNegative(defaultPaddingCm, "defaultPaddingCm");
        requireNonNegative(minGroupExtent, "minGroupExtent");
        requireNonNegative(exportClusterToleranceCm, "exportClusterToleranceCm");

        if (maxResolutionPasses < 1) {
            throw new IllegalArgumentException("maxResolutionPasses must be at least 1");
        }
        if (maxFallbackPasses < 1) {
            throw new IllegalArgumentException("maxFallbackPasses must be at least 1");
        }
        if (gridColumns < 1) {
            throw new IllegalArgumentException("gridColumns must be at least 1");
        }
        if (alignmentThreshold > gridSize / 2) {
            throw new IllegalArgumentException("alignmentThreshold must not exceed half the gridSize");
        }
    }

    /**
     * Returns the policy reproducing the interactive editor's behaviour.
     *
     * <p>Default values:</p>
     * <ul>
     *   <li>50 canvas units per cm, document origin at (400, 300)</li>
     *   <li>grid 20, alignment threshold 10</li>
     *   <li>shifts: above 1.5 cm, below 2.0 cm, left 2.0 cm, right 2.0 cm</li>
     *   <li>20 resolution passes, 10 fallback passes</li>
     *   <li>connector offset (150, 100)</li>
     *   <li>4-column fallback grid at (400, 500), cells 150 x 100</li>
     *   <li>padding 0.3 cm, minimum group extent 20</li>
     *   <li>export tolerance 0.5 cm, export quantum 0.5 cm</li>
     *   <li>unmatched coordinate (0, 0)</li>
     * </ul>
     */
    public static LayoutPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Unit conversion
    // ---------------------------------------------------------------------

    public Point toCanvas(DocumentPoint p) {
        return new Point(
                p.x() * pixelsPerCm + documentOrigin.x(),
                -p.y() * pixelsPerCm + documentOrigin.y());
    }

    public DocumentPoint toDocument(Point p) {
        return new DocumentPoint(
                (p.x() - documentOrigin.x()) / pixelsPerCm,
                -(p.y() - documentOrigin.y()) / pixelsPerCm);
    }

    /** Converts a document length to a canvas length. */
    public double toCanvasLength(double cm) {
        return cm * pixelsPerCm;
    }

    /** The base grid expressed in document units. */
    public double gridSizeCm() {
        return gridSize / pixelsPerCm;
    }

    /**
     * Default shift magnitude for a direction, signed in document orientation
     * (above and right are positive).
     */
    public double defaultShiftCm(Direction direction) {
        return switch (direction) {
            case ABOVE -> shiftAboveCm;
            case BELOW -> -shiftBelowCm;
            case LEFT -> -shiftLeftCm;
            case RIGHT -> shiftRightCm;
        };
    }

    private static void requirePositive(double value, String name) {
        if (!(value > 0)) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    private static void requireNonNegative(double value, String name) {
        if (!(value >= 0)) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }

    public static final class Builder {
        private double pixelsPerCm = 50;
        private Point documentOrigin = new Point(400, 300);
        private double gridSize = 20;
        private double alignmentThreshold = 10;
        private double shiftAboveCm = 1.5;
        private double shiftBelowCm = 2.0;
        private double shiftLeftCm = 2.0;
        private double shiftRightCm = 2.0;
        private int maxResolutionPasses = 20;
        private int maxFallbackPasses = 10;
        private Point connectorOffset = new Point(150, 100);
        private int gridColumns = 4;
        private Point gridOrigin = new Point(400, 500);
        private double gridCellWidth = 150;
        private double gridCellHeight = 100;
        private double defaultPaddingCm = 0.3;
        private double minGroupExtent = 20;
        private double exportClusterToleranceCm = 0.5;
        private double exportQuantumCm = 0.5;
        private DocumentPoint unmatchedCoordinate = DocumentPoint.ORIGIN;

        private Builder() {
        }

        public Builder withScale(double pixelsPerCm, Point documentOrigin) {
            this.pixelsPerCm = pixelsPerCm;
            this.documentOrigin = documentOrigin;
            return this;
        }

        public Builder withGridSize(double gridSize) {
            this.gridSize = gridSize;
            return this;
        }

        public Builder withAlignmentThreshold(double alignmentThreshold) {
            this.alignmentThreshold = alignmentThreshold;
            return this;
        }

        public Builder withDefaultShifts(double aboveCm, double belowCm, double leftCm, double rightCm) {
            this.shiftAboveCm = aboveCm;
            this.shiftBelowCm = belowCm;
            this.shiftLeftCm = leftCm;
            this.shiftRightCm = rightCm;
            return this;
        }

        public Builder withIterationCaps(int maxResolutionPasses, int maxFallbackPasses) {
            this.maxResolutionPasses = maxResolutionPasses;
            this.maxFallbackPasses = maxFallbackPasses;
            return this;
        }

        public Builder withConnectorOffset(Point connectorOffset) {
            this.connectorOffset = connectorOffset;
            return this;
        }

        public Builder withFallbackGrid(int columns, Point origin, double cellWidth, double cellHeight) {
            this.gridColumns = columns;
            this.gridOrigin = origin;
            this.gridCellWidth = cellWidth;
            this.gridCellHeight = cellHeight;
            return this;
        }

        public Builder withDefaultPaddingCm(double defaultPaddingCm) {
            this.defaultPaddingCm = defaultPaddingCm;
            return this;
        }

        public Builder withMinGroupExtent(double minGroupExtent) {
            this.minGroupExtent = minGroupExtent;
            return this;
        }

        public Builder withExportClustering(double toleranceCm, double quantumCm) {
            this.exportClusterToleranceCm = toleranceCm;
            this.exportQuantumCm = quantumCm;
            return this;
        }

        public Builder withUnmatchedCoordinate(DocumentPoint unmatchedCoordinate) {
            this.unmatchedCoordinate = unmatchedCoordinate;
            return this;
        }

        public LayoutPolicy build() {
            return new LayoutPolicy(
                    pixelsPerCm, documentOrigin, gridSize, alignmentThreshold,
                    shiftAboveCm, shiftBelowCm, shiftLeftCm, shiftRightCm,
                    maxResolutionPasses, maxFallbackPasses, connectorOffset,
                    gridColumns, gridOrigin, gridCellWidth, gridCellHeight,
                    defaultPaddingCm, minGroupExtent,
                    exportClusterToleranceCm, exportQuantumCm, unmatchedCoordinate);
        }
    }
}
