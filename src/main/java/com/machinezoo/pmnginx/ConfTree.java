// Part of PMNginx
package com.machinezoo.pmnginx;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Parsing is best-effort. Malformed input is reported through the two flags, never by throwing.
 * Partial trees are processed like any other tree.
 */
/**
 * Result of {@link ConfParser}: root nodes plus information about how well-formed the input was.
 */
@StubDocs
public class ConfTree {
	private final List<ConfNode> nodes;
	public List<ConfNode> nodes() {
		return nodes;
	}
	/*
	 * False when a stray closing brace ended the root level early.
	 */
	private final boolean balanced;
	public boolean balanced() {
		return balanced;
	}
	/*
	 * False when input ended while some block was still open.
	 */
	private final boolean complete;
	public boolean complete() {
		return complete;
	}
	public ConfTree(List<ConfNode> nodes, boolean balanced, boolean complete) {
		this.nodes = List.copyOf(nodes);
		this.balanced = balanced;
		this.complete = complete;
	}
	public boolean partial() {
		return !balanced || !complete;
	}
	public boolean empty() {
		return nodes.isEmpty();
	}
}
