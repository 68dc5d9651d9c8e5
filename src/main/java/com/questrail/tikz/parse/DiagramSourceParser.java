package com.questrail.tikz.parse;

/**
 * DiagramSourceParser
 * -----------------------------------------------------------------------------
 * Text-level boundary of the engine: raw document text in, unresolved records
 * out.
 *
 * <p>The parser is responsible only for:</p>
 * <ul>
 *   <li>Locating node, connector and group declarations</li>
 *   <li>Extracting style, name, position and label fields from them</li>
 *   <li>Skipping anything it does not recognize</li>
 * </ul>
 *
 * <p>The parser is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Assigning coordinates (see {@code PositionResolver})</li>
 *   <li>Checking that connector endpoints or group members exist</li>
 *   <li>Computing group bounding boxes</li>
 * </ul>
 *
 * <p>Parsing never fails. Unrecognized or malformed fragments are skipped and
 * reported as anomalies; the worst case is an empty document.</p>
 */
public interface DiagramSourceParser
{
    /**
     * Parses one whole document.
     *
     * @param source complete document text; {@code null} is treated as empty
     * @return the records found, in declaration order
     */
    ParsedDocument parse(String source);
}
