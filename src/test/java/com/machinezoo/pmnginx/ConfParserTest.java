// Part of PMNginx
package com.machinezoo.pmnginx;

import static org.assertj.core.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;

public class ConfParserTest {
	private static ConfNode.Directive directive(String name, String... args) {
		return new ConfNode.Directive(name, List.of(args));
	}
	@Test public void directives() {
		var tree = ConfParser.parse("worker_processes 1; error_log logs/error.log warn;");
		assertThat(tree.nodes()).containsExactly(
			directive("worker_processes", "1"),
			directive("error_log", "logs/error.log", "warn"));
		assertThat(tree.partial()).isFalse();
	}
	@Test public void nestedBlocks() {
		var tree = ConfParser.parse("http { server { listen 80; location / { root html; } } }");
		assertThat(tree.nodes()).hasSize(1);
		var http = (ConfNode.Block)tree.nodes().get(0);
		assertThat(http.name()).isEqualTo("http");
		var server = (ConfNode.Block)http.children().get(0);
		assertThat(server.children()).hasSize(2);
		var location = (ConfNode.Block)server.children().get(1);
		assertThat(location.args()).containsExactly("/");
		assertThat(location.children()).containsExactly(directive("root", "html"));
		assertThat(tree.balanced()).isTrue();
		assertThat(tree.complete()).isTrue();
	}
	@Test public void emptyGroupsAreSkipped() {
		var tree = ConfParser.parse(";; a; ;");
		assertThat(tree.nodes()).containsExactly(directive("a"));
	}
	@Test public void danglingDirectiveBeforeClose() {
		var tree = ConfParser.parse("server { listen 80 } root x;");
		var server = (ConfNode.Block)tree.nodes().get(0);
		assertThat(server.children()).containsExactly(directive("listen", "80"));
		assertThat(tree.nodes().get(1)).isEqualTo(directive("root", "x"));
	}
	@Test public void strayCloseEndsRoot() {
		var tree = ConfParser.parse("a; } b;");
		assertThat(tree.nodes()).containsExactly(directive("a"));
		assertThat(tree.balanced()).isFalse();
		assertThat(tree.partial()).isTrue();
	}
	@Test public void endOfInputInsideBlock() {
		var tree = ConfParser.parse("http { server { listen 8080;");
		assertThat(tree.complete()).isFalse();
		var http = (ConfNode.Block)tree.nodes().get(0);
		var server = (ConfNode.Block)http.children().get(0);
		assertThat(server.children()).containsExactly(directive("listen", "8080"));
	}
	@Test public void unterminatedTrailingStatement() {
		assertThat(ConfParser.parse("a; b c").nodes()).containsExactly(directive("a"), directive("b", "c"));
	}
	@Test public void emptyInput() {
		var tree = ConfParser.parse("   # nothing here\n");
		assertThat(tree.empty()).isTrue();
		assertThat(tree.partial()).isFalse();
	}
	@Test public void match() {
		ConfNode node = ConfParser.parse("events { }").nodes().get(0);
		String kind = node.match(d -> "directive", b -> "block");
		assertThat(kind).isEqualTo("block");
	}
}
