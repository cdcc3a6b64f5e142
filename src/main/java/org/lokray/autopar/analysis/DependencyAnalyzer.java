package org.lokray.autopar.analysis;

import org.antlr.v4.runtime.Token;
import org.lokray.autopar.parser.CSourceLexer;
import org.lokray.autopar.source.StatementScanner;
import org.lokray.autopar.source.TokenizedSource;
import org.lokray.autopar.util.ErrorHandler;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies a loop body for parallel execution.
 * <p>
 * The body is reduced to a list of {@link AccessChain}s. Variables declared in the body are
 * private to each iteration; every write to anything else must be either an element owned
 * by the iteration (subscripted by the induction variable) or a reduction. The analysis is
 * a heuristic: aliasing and calls into unknown functions are not followed.
 */
public class DependencyAnalyzer
{
	static final Set<String> IO_NAMES = Set.of(
			"cout", "cin", "cerr", "clog", "printf", "scanf", "fprintf", "fscanf", "puts", "gets",
			"fgets", "fputs", "getchar", "putchar", "fread", "fwrite", "fopen", "fclose", "iostream",
			"ifstream", "ofstream", "fstream", "getline", "perror");

	static final Set<String> MUTATING_METHODS = Set.of(
			"push_back", "emplace_back", "push_front", "emplace_front", "insert", "erase",
			"push", "pop", "clear", "resize", "assign");

	// Words that may precede a name without making it a declaration
	private static final Set<String> NON_TYPE_WORDS = Set.of(
			"delete", "new", "throw", "case", "sizeof", "using", "namespace", "typedef",
			"co_return", "co_yield", "co_await");

	private static final Set<Integer> WRITE_OPS = Set.of(
			CSourceLexer.ASSIGN, CSourceLexer.PLUS_ASSIGN, CSourceLexer.MINUS_ASSIGN,
			CSourceLexer.STAR_ASSIGN, CSourceLexer.DIV_ASSIGN, CSourceLexer.MOD_ASSIGN,
			CSourceLexer.AND_ASSIGN, CSourceLexer.OR_ASSIGN, CSourceLexer.XOR_ASSIGN,
			CSourceLexer.SHL_ASSIGN, CSourceLexer.SHR_ASSIGN, CSourceLexer.INC, CSourceLexer.DEC);

	// Updates that can be merged across threads, with the operator used to combine them
	private static final Map<Integer, String> REDUCIBLE_OPS = Map.of(
			CSourceLexer.PLUS_ASSIGN, "+",
			CSourceLexer.MINUS_ASSIGN, "+",
			CSourceLexer.INC, "+",
			CSourceLexer.DEC, "+",
			CSourceLexer.STAR_ASSIGN, "*",
			CSourceLexer.AND_ASSIGN, "&",
			CSourceLexer.OR_ASSIGN, "|",
			CSourceLexer.XOR_ASSIGN, "^");

	private static final Set<Integer> DECLARATOR_FOLLOWERS = Set.of(
			CSourceLexer.ASSIGN, CSourceLexer.SEMI, CSourceLexer.COMMA, CSourceLexer.LBRACKET,
			CSourceLexer.LBRACE, CSourceLexer.LPAREN, CSourceLexer.COLON);

	/**
	 * Lexes {@code bodyText} and analyzes it.
	 */
	public DependencyReport analyze(String bodyText, String inductionVariable)
	{
		List<Token> body = TokenizedSource.tokenize(bodyText, new ErrorHandler()).getCode();
		return analyze(body, inductionVariable);
	}

	public DependencyReport analyze(List<Token> body, String inductionVariable)
	{
		StatementScanner scanner = new StatementScanner(body);
		List<AccessChain> chains = collectChains(body, scanner);

		boolean simpleArrayAccess = chains.stream().anyMatch(c -> c.subscripts().contains(inductionVariable));
		Set<String> ioCalls = new LinkedHashSet<>();
		boolean hasBreakContinue = false;
		boolean hasEarlyExit = false;
		for (Token token : body)
		{
			switch (token.getType())
			{
				case CSourceLexer.IDENTIFIER ->
				{
					if (IO_NAMES.contains(token.getText()))
					{
						ioCalls.add(token.getText());
					}
				}
				case CSourceLexer.BREAK, CSourceLexer.CONTINUE -> hasBreakContinue = true;
				case CSourceLexer.RETURN, CSourceLexer.GOTO -> hasEarlyExit = true;
				default ->
				{
				}
			}
		}

		Set<String> dependencies = new LinkedHashSet<>();
		List<LocalScope> locals = localScopes(chains, body, scanner);
		List<Reduction> reductions = findReductionsAndDependencies(chains, locals, inductionVariable, dependencies);

		List<String> findings = new ArrayList<>();
		if (!simpleArrayAccess)
		{
			findings.add("no array is subscripted by '" + inductionVariable + "'");
		}
		if (!ioCalls.isEmpty())
		{
			findings.add("performs I/O (" + String.join(", ", ioCalls) + ")");
		}
		if (hasBreakContinue)
		{
			findings.add("contains break or continue");
		}
		if (hasEarlyExit)
		{
			findings.add("leaves the loop through return or goto");
		}
		findings.addAll(dependencies);

		// Declared-in-body variables are private by construction, so none are listed
		return new DependencyReport(
				simpleArrayAccess,
				!ioCalls.isEmpty(),
				hasBreakContinue,
				hasEarlyExit,
				!dependencies.isEmpty(),
				reductions,
				List.of(),
				findings);
	}

	/**
	 * A body-local variable, visible from its declarator to the end of the enclosing block
	 * (or of the statement whose header declares it).
	 */
	private record LocalScope(String name, int from, int to)
	{
		boolean covers(AccessChain chain)
		{
			return chain.base().equals(name) && chain.index() >= from && chain.index() <= to;
		}
	}

	private static List<LocalScope> localScopes(List<AccessChain> chains, List<Token> body, StatementScanner scanner)
	{
		List<LocalScope> locals = new ArrayList<>();
		for (AccessChain chain : chains)
		{
			if (chain.declaration())
			{
				locals.add(new LocalScope(chain.base(), chain.index(), scopeEnd(body, scanner, chain.index())));
			}
		}
		return locals;
	}

	/**
	 * @return index of the last token where a name declared at {@code declarationIndex} is visible
	 */
	private static int scopeEnd(List<Token> body, StatementScanner scanner, int declarationIndex)
	{
		int last = body.size() - 1;
		int depth = 0;
		for (int j = declarationIndex - 1; j >= 0; j--)
		{
			int type = scanner.type(j);
			if (type == CSourceLexer.RPAREN || type == CSourceLexer.RBRACKET || type == CSourceLexer.RBRACE)
			{
				depth++;
			}
			else if (type == CSourceLexer.LPAREN || type == CSourceLexer.LBRACKET || type == CSourceLexer.LBRACE)
			{
				if (depth > 0)
				{
					depth--;
					continue;
				}
				if (type == CSourceLexer.LBRACE)
				{
					int close = scanner.matchingClose(j);
					return close == StatementScanner.NO_END ? last : close;
				}
				int owner = scanner.type(j - 1);
				if (type == CSourceLexer.LPAREN && (owner == CSourceLexer.FOR || owner == CSourceLexer.IF
						|| owner == CSourceLexer.WHILE || owner == CSourceLexer.SWITCH))
				{
					int end = scanner.statementEnd(j - 1);
					return end == StatementScanner.NO_END ? last : end;
				}
			}
		}
		return last;
	}

	private static List<Reduction> findReductionsAndDependencies(List<AccessChain> chains, List<LocalScope> locals, String inductionVariable, Set<String> dependencies)
	{
		Map<String, List<AccessChain>> accumulations = new LinkedHashMap<>();
		Set<String> writtenArrays = new LinkedHashSet<>();

		for (AccessChain chain : chains)
		{
			// Stores through a pointer reach memory the analysis cannot attribute to the iteration
			if (chain.dereferenced() && chain.isWrite())
			{
				dependencies.add("writes through pointer '" + chain.path() + "'");
				continue;
			}
			if (locals.stream().anyMatch(local -> local.covers(chain)))
			{
				continue;
			}

			if (chain.call() && MUTATING_METHODS.contains(chain.lastMember()))
			{
				dependencies.add("calls " + chain.lastMember() + "() on shared '" + chain.base() + "'");
				continue;
			}
			if (!chain.isWrite())
			{
				continue;
			}

			if (!chain.subscripts().isEmpty())
			{
				writtenArrays.add(chain.key());
			}
			else if (chain.isPlainName() && chain.base().equals(inductionVariable))
			{
				dependencies.add("modifies induction variable '" + inductionVariable + "'");
			}
			else if (chain.isPlainName() && REDUCIBLE_OPS.containsKey(chain.writeOp()))
			{
				accumulations.computeIfAbsent(chain.base(), name -> new ArrayList<>()).add(chain);
			}
			else
			{
				dependencies.add("writes shared variable '" + chain.path() + "'");
			}
		}

		// Each accumulation must be the only use of its variable in the body
		List<Reduction> reductions = new ArrayList<>();
		for (Map.Entry<String, List<AccessChain>> entry : accumulations.entrySet())
		{
			String name = entry.getKey();
			List<AccessChain> updates = entry.getValue();
			Set<String> operators = new LinkedHashSet<>();
			updates.forEach(update -> operators.add(REDUCIBLE_OPS.get(update.writeOp())));

			boolean usedElsewhere = chains.stream()
					.anyMatch(c -> c.base().equals(name) && updates.stream().noneMatch(u -> u == c));
			if (operators.size() > 1)
			{
				dependencies.add("combines '" + name + "' with mixed operators " + operators);
			}
			else if (usedElsewhere)
			{
				dependencies.add("reads accumulated variable '" + name + "' outside its updates");
			}
			else
			{
				reductions.add(new Reduction(name, operators.iterator().next()));
			}
		}

		// A written array must be indexed by the induction variable, in the same dimension, everywhere
		for (String array : writtenArrays)
		{
			List<AccessChain> accesses = chains.stream()
					.filter(c -> c.key().equals(array) && !c.call())
					.toList();
			if (accesses.stream().anyMatch(c -> c.subscripts().isEmpty()))
			{
				dependencies.add("uses written array '" + array + "' without a subscript");
				continue;
			}
			Set<Integer> shared = null;
			for (AccessChain access : accesses)
			{
				Set<Integer> dimensions = access.dimensionsIndexedBy(inductionVariable);
				if (shared == null)
				{
					shared = dimensions;
				}
				else
				{
					shared.retainAll(dimensions);
				}
			}
			if (shared == null || shared.isEmpty())
			{
				dependencies.add("accesses '" + array + "' with an index other than '" + inductionVariable + "'");
			}
		}
		return reductions;
	}

	private static List<AccessChain> collectChains(List<Token> body, StatementScanner scanner)
	{
		Set<Integer> declared = declaredNames(body, scanner);
		List<AccessChain> chains = new ArrayList<>();

		for (int k = 0; k < body.size(); k++)
		{
			if (body.get(k).getType() != CSourceLexer.IDENTIFIER || continuesChain(scanner, k))
			{
				continue;
			}

			String base = body.get(k).getText();
			StringBuilder path = new StringBuilder(base);
			String key = null;
			List<String> subscripts = new ArrayList<>();
			int j = k + 1;
			while (true)
			{
				int type = scanner.type(j);
				if ((type == CSourceLexer.DOT || type == CSourceLexer.ARROW || type == CSourceLexer.SCOPE)
						&& scanner.type(j + 1) == CSourceLexer.IDENTIFIER)
				{
					path.append(body.get(j).getText()).append(body.get(j + 1).getText());
					j += 2;
				}
				else if (type == CSourceLexer.LBRACKET)
				{
					int close = scanner.matchingClose(j);
					if (close == StatementScanner.NO_END)
					{
						break;
					}
					if (key == null)
					{
						key = path.toString();
					}
					subscripts.add(joinText(body, j + 1, close));
					path.append("[]");
					j = close + 1;
				}
				else
				{
					break;
				}
			}

			int next = scanner.type(j);
			int previous = scanner.type(k - 1);
			boolean declaration = declared.contains(k);
			int star = previous == CSourceLexer.INC || previous == CSourceLexer.DEC ? k - 2 : k - 1;
			boolean dereferenced = scanner.type(star) == CSourceLexer.STAR && !endsOperand(scanner.type(star - 1));
			int writeOp = 0;
			if (WRITE_OPS.contains(next))
			{
				writeOp = next;
				if (dereferenced && (next == CSourceLexer.INC || next == CSourceLexer.DEC) && WRITE_OPS.contains(scanner.type(j + 1)))
				{
					writeOp = scanner.type(j + 1); // *p++ = v stores through p
				}
			}
			else if (previous == CSourceLexer.INC || previous == CSourceLexer.DEC)
			{
				writeOp = previous;
			}
			else if (dereferenced && (scanner.type(k - 2) == CSourceLexer.INC || scanner.type(k - 2) == CSourceLexer.DEC))
			{
				writeOp = scanner.type(k - 2);
			}
			if (declaration && next == CSourceLexer.ASSIGN)
			{
				writeOp = 0; // initialization
			}

			chains.add(new AccessChain(
					k,
					base,
					key == null ? path.toString() : key,
					path.toString(),
					subscripts,
					writeOp,
					declaration,
					next == CSourceLexer.LPAREN,
					dereferenced));
		}
		return chains;
	}

	/**
	 * True when a token of this type can end an operand, making a following '*' binary.
	 */
	private static boolean endsOperand(int type)
	{
		return type == CSourceLexer.IDENTIFIER || type == CSourceLexer.NUMBER || type == CSourceLexer.STRING
				|| type == CSourceLexer.CHAR_LITERAL || type == CSourceLexer.RPAREN || type == CSourceLexer.RBRACKET;
	}

	/**
	 * True when the identifier at {@code index} is a member or qualified part of a
	 * reference that starts earlier.
	 */
	private static boolean continuesChain(StatementScanner scanner, int index)
	{
		int previous = scanner.type(index - 1);
		if (previous == CSourceLexer.DOT || previous == CSourceLexer.ARROW)
		{
			return true;
		}
		return previous == CSourceLexer.SCOPE
				&& (scanner.type(index - 2) == CSourceLexer.IDENTIFIER || scanner.type(index - 2) == CSourceLexer.GT);
	}

	/**
	 * @return token indices of every name declared in the body, including the later
	 * declarators of a comma-separated declaration
	 */
	private static Set<Integer> declaredNames(List<Token> body, StatementScanner scanner)
	{
		Set<Integer> declared = new HashSet<>();
		for (int k = 0; k < body.size(); k++)
		{
			if (!isDeclarator(body, scanner, k))
			{
				continue;
			}
			declared.add(k);

			int depth = 0;
			for (int j = k + 1; j < body.size(); j++)
			{
				int type = scanner.type(j);
				if (type == CSourceLexer.LPAREN || type == CSourceLexer.LBRACKET || type == CSourceLexer.LBRACE)
				{
					depth++;
				}
				else if (type == CSourceLexer.RPAREN || type == CSourceLexer.RBRACKET || type == CSourceLexer.RBRACE)
				{
					if (--depth < 0)
					{
						break;
					}
				}
				else if (type == CSourceLexer.SEMI && depth == 0)
				{
					break;
				}
				else if (type == CSourceLexer.COMMA && depth == 0)
				{
					int m = j + 1;
					while (scanner.type(m) == CSourceLexer.STAR || scanner.type(m) == CSourceLexer.AMP)
					{
						m++;
					}
					if (scanner.type(m) == CSourceLexer.IDENTIFIER)
					{
						declared.add(m);
					}
				}
			}
		}
		return declared;
	}

	/**
	 * A name is declared when a type (identifiers, qualifiers, template arguments, pointer
	 * and reference marks) sits between it and the start of its statement.
	 */
	private static boolean isDeclarator(List<Token> body, StatementScanner scanner, int index)
	{
		if (scanner.type(index) != CSourceLexer.IDENTIFIER
				|| NON_TYPE_WORDS.contains(body.get(index).getText())
				|| !DECLARATOR_FOLLOWERS.contains(scanner.type(index + 1)))
		{
			return false;
		}

		int j = index - 1;
		while (scanner.type(j) == CSourceLexer.STAR || scanner.type(j) == CSourceLexer.AMP || scanner.type(j) == CSourceLexer.AND_AND)
		{
			j--;
		}
		if (scanner.type(j) != CSourceLexer.IDENTIFIER && scanner.type(j) != CSourceLexer.GT)
		{
			return false;
		}

		int templateDepth = 0;
		boolean sawTypeName = false;
		while (j >= 0)
		{
			int type = scanner.type(j);
			if (templateDepth > 0)
			{
				if (type == CSourceLexer.GT)
				{
					templateDepth++;
				}
				else if (type == CSourceLexer.LT)
				{
					templateDepth--;
				}
			}
			else if (type == CSourceLexer.GT)
			{
				templateDepth++;
			}
			else if (type == CSourceLexer.IDENTIFIER)
			{
				if (NON_TYPE_WORDS.contains(body.get(j).getText()))
				{
					return false;
				}
				sawTypeName = true;
			}
			else if (type != CSourceLexer.SCOPE && type != CSourceLexer.STAR && type != CSourceLexer.AMP && type != CSourceLexer.AND_AND)
			{
				break;
			}
			j--;
		}
		if (!sawTypeName || templateDepth > 0)
		{
			return false;
		}

		int start = scanner.type(j);
		if (start == CSourceLexer.LPAREN)
		{
			int owner = scanner.type(j - 1);
			return owner == CSourceLexer.FOR || owner == CSourceLexer.IF || owner == CSourceLexer.WHILE
					|| owner == CSourceLexer.SWITCH
					|| (owner == CSourceLexer.IDENTIFIER && body.get(j - 1).getText().equals("catch"));
		}
		return start == Token.EOF || start == CSourceLexer.SEMI || start == CSourceLexer.LBRACE
				|| start == CSourceLexer.RBRACE || start == CSourceLexer.COLON;
	}

	private static String joinText(List<Token> tokens, int from, int to)
	{
		StringBuilder text = new StringBuilder();
		for (int i = from; i < to; i++)
		{
			text.append(tokens.get(i).getText());
		}
		return text.toString();
	}
}
