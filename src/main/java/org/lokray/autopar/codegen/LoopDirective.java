package org.lokray.autopar.codegen;

import org.lokray.autopar.analysis.LoopRecord;

/**
 * A synthesized directive line paired with the loop it goes in front of.
 */
public record LoopDirective(LoopRecord loop, String directive)
{
}
