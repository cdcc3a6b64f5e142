package org.lokray.autopar;

/**
 * Pipeline phases, in the only order they run.
 */
public enum Phase
{
	LOAD,
	INDEX_FUNCTIONS,
	LOCATE_LOOPS,
	ANALYZE_EACH_LOOP,
	SYNTHESIZE_DIRECTIVES,
	REWRITE,
	EMIT
}
