// Part of PMNginx
package com.machinezoo.pmnginx;

import static java.util.stream.Collectors.*;
import java.util.*;

/*
 * Lookups only look at the given siblings, never at grandchildren.
 * Single-valued lookups take the first match and ignore later duplicates.
 */
public class ConfQuery {
	public static List<ConfNode.Block> blocks(List<ConfNode> nodes, String name) {
		return nodes.stream()
			.map(n -> n.match(d -> (ConfNode.Block)null, b -> b))
			.filter(b -> b != null && b.name().equals(name))
			.collect(toList());
	}
	public static List<ConfNode.Directive> directives(List<ConfNode> nodes, String name) {
		return nodes.stream()
			.map(n -> n.match(d -> d, b -> (ConfNode.Directive)null))
			.filter(d -> d != null && d.name().equals(name))
			.collect(toList());
	}
	public static Optional<ConfNode.Block> block(List<ConfNode> nodes, String name) {
		return blocks(nodes, name).stream().findFirst();
	}
	public static Optional<ConfNode.Directive> directive(List<ConfNode> nodes, String name) {
		return directives(nodes, name).stream().findFirst();
	}
	/*
	 * Most directives are used only for their first argument.
	 */
	public static Optional<String> argument(List<ConfNode> nodes, String name) {
		return directive(nodes, name)
			.flatMap(d -> d.args().stream().findFirst());
	}
}
