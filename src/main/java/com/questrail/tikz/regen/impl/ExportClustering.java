package com.questrail.tikz.regen.impl;

import com.questrail.tikz.config.LayoutPolicy;
import com.questrail.tikz.model.DocumentPoint;
import com.questrail.tikz.model.NodeRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * ExportClustering
 * -----------------------------------------------------------------------------
 * Removes drag jitter from exported coordinates.
 *
 * <p>Node centers are converted to document units and, in snap mode, first
 * rounded to the document grid. Then, for the y axis and afterwards the x
 * axis:</p>
 * <ol>
 *   <li>each node joins the first cluster whose key lies within tolerance of
 *       its value, or opens a new cluster keyed by its value rounded to the
 *       quantum;</li>
 *   <li>clusters are visited by ascending key and merged into the first
 *       earlier cluster within tolerance;</li>
 *   <li>every node of a cluster with more than one member is set to the
 *       cluster mean, rounded to the quantum.</li>
 * </ol>
 *
 * <p>The quantum is the document grid in snap mode and the export quantum
 * otherwise. Precision is one decimal in snap mode and two otherwise.</p>
 */
final class ExportClustering
{
    private final LayoutPolicy layout;

    ExportClustering(LayoutPolicy layout) {
        this.layout = layout;
    }

    ExportCoordinates compute(List<NodeRecord> resolved, boolean gridSnap) {
        final double quantum = gridSnap ? layout.gridSizeCm() : layout.exportQuantumCm();

        Map<String, Double> xs = new LinkedHashMap<>();
        Map<String, Double> ys = new LinkedHashMap<>();
        for (NodeRecord node : resolved) {
            DocumentPoint p = layout.toDocument(node.requireCenter());
            double x = p.x();
            double y = p.y();
            if (gridSnap) {
                x = roundTo(x, quantum);
                y = roundTo(y, quantum);
            }
            xs.put(node.name(), x);
            ys.put(node.name(), y);
        }

        clusterAxis(ys, quantum);
        clusterAxis(xs, quantum);

        Map<String, DocumentPoint> out = new LinkedHashMap<>();
        for (String name : xs.keySet()) {
            out.put(name, new DocumentPoint(xs.get(name), ys.get(name)));
        }
        return new ExportCoordinates(out, gridSnap ? 1 : 2);
    }

    private void clusterAxis(Map<String, Double> values, double quantum) {
        final double tolerance = layout.exportClusterToleranceCm();

        Map<Double, List<String>> clusters = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : values.entrySet()) {
            Double key = null;
            for (Double k : clusters.keySet()) {
                if (Math.abs(e.getValue() - k) < tolerance) {
                    key = k;
                    break;
                }
            }
            if (key == null) {
                key = roundTo(e.getValue(), quantum);
            }
            clusters.computeIfAbsent(key, k -> new ArrayList<>()).add(e.getKey());
        }

        Map<Double, List<String>> merged = new LinkedHashMap<>();
        for (Map.Entry<Double, List<String>> c : new TreeMap<>(clusters).entrySet()) {
            Double into = null;
            for (Double k : merged.keySet()) {
                if (Math.abs(c.getKey() - k) < tolerance) {
                    into = k;
                    break;
                }
            }
            if (into == null) {
                merged.put(c.getKey(), new ArrayList<>(c.getValue()));
            } else {
                merged.get(into).addAll(c.getValue());
            }
        }

        for (List<String> names : merged.values()) {
            if (names.size() < 2) {
                continue;
            }
            double sum = 0;
            for (String n : names) {
                sum += values.get(n);
            }
            double mean = roundTo(sum / names.size(), quantum);
            for (String n : names) {
                values.put(n, mean);
            }
        }
    }

    static double roundTo(double value, double quantum) {
        return Math.round(value / quantum) * quantum;
    }
}
