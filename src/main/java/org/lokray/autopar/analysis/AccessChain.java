package org.lokray.autopar.analysis;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One variable reference in a loop body: {@code base(.m | ->m | ::m | [expr])*}.
 *
 * @param index       token index of the leading identifier in the body
 * @param base        the leading identifier
 * @param key         the text before the first subscript, e.g. {@code img.gray}
 * @param path        the whole reference with subscripts elided, e.g. {@code img.gray[]}
 * @param subscripts  subscript texts with whitespace removed, outermost first
 * @param writeOp     token type of the assignment, increment or decrement applied to it; 0 if read
 * @param declaration the reference declares a body-local variable
 * @param call        the reference is immediately called
 * @param dereferenced the reference is the operand of a unary {@code *}
 */
record AccessChain(
		int index,
		String base,
		String key,
		String path,
		List<String> subscripts,
		int writeOp,
		boolean declaration,
		boolean call,
		boolean dereferenced
)
{
	AccessChain
	{
		subscripts = List.copyOf(subscripts);
	}

	boolean isWrite()
	{
		return writeOp != 0;
	}

	boolean isPlainName()
	{
		return path.equals(base);
	}

	/**
	 * @return the dimensions subscripted by exactly {@code variable}
	 */
	Set<Integer> dimensionsIndexedBy(String variable)
	{
		Set<Integer> dimensions = new HashSet<>();
		for (int d = 0; d < subscripts.size(); d++)
		{
			if (subscripts.get(d).equals(variable))
			{
				dimensions.add(d);
			}
		}
		return dimensions;
	}

	/**
	 * @return the member called on the receiver, e.g. {@code push_back} for {@code v.push_back}
	 */
	String lastMember()
	{
		int dot = Math.max(path.lastIndexOf('.'), path.lastIndexOf("->") + 1);
		return dot <= 0 ? "" : path.substring(dot + 1);
	}
}
