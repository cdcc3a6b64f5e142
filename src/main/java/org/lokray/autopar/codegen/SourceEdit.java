package org.lokray.autopar.codegen;

/**
 * Inserts {@code text} (one or more complete lines) before original line {@code line}.
 * A line equal to the source's line count appends at the end. Among edits on the same
 * line, the lower {@code sequence} comes first.
 */
public record SourceEdit(int line, int sequence, String text)
{
}
