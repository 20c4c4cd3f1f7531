// Part of PMNginx
package com.machinezoo.pmnginx;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Single pass over the tokens without backtracking. Nesting is tracked by recursion.
 * Brace balance is not validated. Problems only clear the flags in ConfTree.
 */
/**
 * Builds {@link ConfTree} from tokens produced by {@link ConfTokenizer}.
 */
@StubDocs
public class ConfParser {
	private final List<ConfToken> tokens;
	private int position;
	private boolean balanced = true;
	private boolean complete = true;
	private ConfParser(List<ConfToken> tokens) {
		this.tokens = tokens;
	}
	public static ConfTree parse(List<ConfToken> tokens) {
		Objects.requireNonNull(tokens);
		var parser = new ConfParser(tokens);
		var nodes = parser.level(0);
		return new ConfTree(nodes, parser.balanced, parser.complete);
	}
	public static ConfTree parse(String text) {
		return parse(ConfTokenizer.tokenize(text));
	}
	private List<ConfNode> level(int depth) {
		var nodes = new ArrayList<ConfNode>();
		while (position < tokens.size()) {
			if (tokens.get(position).kind() == ConfToken.Kind.CLOSE) {
				++position;
				/*
				 * At root level, this is an extra closing brace. It still ends the level.
				 */
				if (depth == 0)
					balanced = false;
				return nodes;
			}
			var parts = new ArrayList<String>();
			while (position < tokens.size() && tokens.get(position).word()) {
				parts.add(tokens.get(position).text());
				++position;
			}
			ConfToken end = position < tokens.size() ? tokens.get(position) : null;
			if (parts.isEmpty()) {
				/*
				 * Lone semicolon or opening brace. There is nothing to attach it to.
				 */
				++position;
				continue;
			}
			String name = parts.get(0);
			List<String> args = parts.subList(1, parts.size());
			if (end == null) {
				/*
				 * Unterminated statement at the end of input. Keep it as a directive.
				 */
				nodes.add(new ConfNode.Directive(name, args));
				break;
			}
			switch (end.kind()) {
				case SEMICOLON:
					++position;
					nodes.add(new ConfNode.Directive(name, args));
					break;
				case OPEN:
					++position;
					nodes.add(new ConfNode.Block(name, args, level(depth + 1)));
					break;
				case CLOSE:
					/*
					 * Dangling statement right before the closing brace. The brace is consumed on the next iteration.
					 */
					nodes.add(new ConfNode.Directive(name, args));
					break;
				default:
					throw new IllegalStateException();
			}
		}
		if (depth > 0)
			complete = false;
		return nodes;
	}
}
