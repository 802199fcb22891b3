package org.stagecraft.compiler.api;

import java.util.Comparator;

/**
 * A pure data class representing a position in a source unit.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The path of the source unit.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    /** Location used for diagnostics that are not tied to any source unit. */
    public static final SourceInfo NONE = new SourceInfo("", 0, 0);

    /** Orders locations by line, then column. File names are not compared. */
    public static final Comparator<SourceInfo> BY_POSITION =
            Comparator.comparingInt(SourceInfo::lineNumber).thenComparingInt(SourceInfo::columnNumber);

    @Override
    public String toString() {
        return String.format("%s:%d:%d", fileName, lineNumber, columnNumber);
    }
}
