package com.questrail.tikz.regen.impl;

import com.questrail.tikz.model.DocumentPoint;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Document coordinates chosen for export, with the precision they are
 * written at.
 */
final class ExportCoordinates
{
    private final Map<String, DocumentPoint> byName;
    private final int precision;

    ExportCoordinates(Map<String, DocumentPoint> byName, int precision) {
        this.byName = Map.copyOf(byName);
        this.precision = precision;
    }

    Optional<DocumentPoint> of(String nodeName) {
        return Optional.ofNullable(byName.get(nodeName));
    }

    int precision() {
        return precision;
    }

    /** {@code at (X.XXcm,Y.YYcm)} at this export's precision. */
    String atClause(DocumentPoint p) {
        return "at (" + format(p.x()) + "cm," + format(p.y()) + "cm)";
    }

    private String format(double v) {
        String s = String.format(Locale.ROOT, "%." + precision + "f", v);
        // A tiny negative value would otherwise print as "-0.00".
        if (s.startsWith("-") && Double.parseDouble(s) == 0.0) {
            return s.substring(1);
        }
        return s;
    }
}
