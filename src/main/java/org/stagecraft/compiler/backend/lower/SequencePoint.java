package org.stagecraft.compiler.backend.lower;

import org.stagecraft.compiler.api.SourceInfo;

/**
 * Maps a code offset of a compiled method to its source location.
 *
 * @param offset The byte offset into the method's code.
 * @param source The source location of the instruction at that offset.
 */
public record SequencePoint(int offset, SourceInfo source) {
}
