package com.questrail.tikz.parse.scan;

/**
 * Indicates that a statement could not be scanned at a given offset.
 *
 * <p>Carries the offset at which scanning can safely resume, so a caller can
 * skip the malformed fragment and continue with the rest of the document.
 * Never escapes the parser.</p>
 */
public final class ScanException extends Exception
{
    private final int offset;
    private final int resumeAt;

    public ScanException(String message, int offset, int resumeAt) {
        super(message);
        this.offset = offset;
        this.resumeAt = resumeAt;
    }

    /** Offset of the fragment that failed to scan. */
    public int offset() {
        return offset;
    }

    /** Offset from which scanning may continue; always greater than {@link #offset()}. */
    public int resumeAt() {
        return resumeAt;
    }
}
