/**
 * Statement Scanning
 * =============================================================================
 *
 * <p>Lexical layer shared by the parser and the regenerator. Nothing here
 * interprets a statement; it only locates statements and the tokens inside
 * them, by character offset, in the raw document text.</p>
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   source text
 *        → VerbatimRegions.nextMarker (comments and option blocks skipped)
 *        → NodeStatementScanner.scanAt (scanHeadAt when the body is unreadable)
 *        → NodeStatement (offsets + raw clauses)
 *        → PositionTokens / GroupDeclarations
 *        → parser (records) or regenerator (rewrites)
 * </pre>
 *
 * <p>Malformed input raises {@link com.questrail.tikz.parse.scan.ScanException}
 * with a resume offset. Callers catch it at the statement boundary and move
 * on; it never escapes the engine.</p>
 */
package com.questrail.tikz.parse.scan;
