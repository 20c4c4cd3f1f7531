// Part of PMNginx
package com.machinezoo.pmnginx;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Lexer for the nginx.conf subset. It never fails. Whatever is left in an unterminated quote is still emitted,
 * because the text is often a config that is being edited right now.
 */
/**
 * Splits configuration text into {@link ConfToken}s.
 */
@StubDocs
public class ConfTokenizer {
	private final String text;
	private final List<ConfToken> tokens = new ArrayList<>();
	private final StringBuilder current = new StringBuilder();
	private int position;
	private ConfTokenizer(String text) {
		this.text = text;
	}
	public static List<ConfToken> tokenize(String text) {
		Objects.requireNonNull(text);
		var tokenizer = new ConfTokenizer(text);
		tokenizer.run();
		return Collections.unmodifiableList(tokenizer.tokens);
	}
	private void flush() {
		if (current.length() == 0)
			return;
		tokens.add(ConfToken.word(current.toString()));
		current.setLength(0);
	}
	/*
	 * Byte order mark is not whitespace for Java, but editors on Windows put it at the start of the file.
	 */
	private static boolean whitespace(char c) {
		return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\uFEFF';
	}
	private void run() {
		while (position < text.length()) {
			char c = text.charAt(position);
			if (c == '"' || c == '\'') {
				++position;
				quoted(c);
			} else if (c == '#') {
				flush();
				while (position < text.length() && text.charAt(position) != '\n')
					++position;
			} else if (whitespace(c)) {
				flush();
				++position;
			} else if (c == '{' || c == '}' || c == ';') {
				flush();
				tokens.add(ConfToken.symbol(c));
				++position;
			} else {
				current.append(c);
				++position;
			}
		}
		flush();
	}
	/*
	 * Quoted text is appended to the pending word. It does not start a new token.
	 * Backslash escapes any character. A backslash that is the last character of input is kept as is.
	 */
	private void quoted(char quote) {
		while (position < text.length()) {
			char c = text.charAt(position);
			if (c == quote) {
				++position;
				return;
			}
			if (c == '\\' && position + 1 < text.length()) {
				current.append(text.charAt(position + 1));
				position += 2;
			} else {
				current.append(c);
				++position;
			}
		}
	}
}
