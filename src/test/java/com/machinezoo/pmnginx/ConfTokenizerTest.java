// Part of PMNginx
package com.machinezoo.pmnginx;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;

public class ConfTokenizerTest {
	private static List<String> texts(String conf) {
		var texts = new ArrayList<String>();
		for (var token : ConfTokenizer.tokenize(conf))
			texts.add(token.text());
		return texts;
	}
	@Test public void words() {
		assertEquals(List.of("listen", "8080", ";"), texts("listen 8080;"));
		assertEquals(List.of("a", "b", "c"), texts("  a\tb\r\nc  "));
	}
	@Test public void symbols() {
		assertEquals(List.of("server", "{", "root", "x", ";", "}"), texts("server{root x;}"));
		var tokens = ConfTokenizer.tokenize("a{");
		assertEquals(ConfToken.Kind.WORD, tokens.get(0).kind());
		assertEquals(ConfToken.Kind.OPEN, tokens.get(1).kind());
	}
	@Test public void comments() {
		assertEquals(List.of("listen", "80", ";", "root", "x", ";"), texts("listen 80; # port\n# whole line\nroot x;"));
		assertEquals(List.of("index"), texts("index#comment without newline"));
	}
	@Test public void quotes() {
		assertEquals(List.of("root", "c:\\path with spaces", ";"), texts("root \"c:\\\\path with spaces\";"));
		assertEquals(List.of("it's"), texts("'it\\'s'"));
		assertEquals(List.of("a \"b\""), texts("'a \"b\"'"));
	}
	@Test public void quotedSymbolsAreWords() {
		var tokens = ConfTokenizer.tokenize("x \"{;}\";");
		assertEquals(3, tokens.size());
		assertEquals(ConfToken.word("{;}"), tokens.get(1));
		assertEquals(ConfToken.Kind.SEMICOLON, tokens.get(2).kind());
	}
	@Test public void quotesJoinAdjacentText() {
		assertEquals(List.of("ab cd"), texts("a\"b c\"d"));
	}
	@Test public void unterminatedQuote() {
		assertEquals(List.of("root", "half done; }"), texts("root \"half done; }"));
		assertEquals(List.of("x\\"), texts("'x\\"));
	}
	@Test public void noEmptyTokens() {
		assertEquals(List.of(), texts(""));
		assertEquals(List.of(), texts("\"\" ''   "));
		assertEquals(List.of(";"), texts("'' ;"));
	}
	@Test public void unicodeSpaces() {
		assertEquals(List.of("a", "b"), texts("a\u00A0b"));
		assertEquals(List.of("a", "b"), texts("a\u2003b"));
	}
	@Test public void byteOrderMark() {
		assertEquals(List.of("http", "{", "}"), texts("\uFEFFhttp { }"));
		assertEquals(List.of("a", "b"), texts("a\uFEFFb"));
	}
}
