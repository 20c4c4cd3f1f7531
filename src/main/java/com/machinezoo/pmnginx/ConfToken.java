// Part of PMNginx
package com.machinezoo.pmnginx;

import java.util.*;

/*
 * Quoted text always produces WORD tokens, so that "{" in quotes is an ordinary argument.
 */
public final class ConfToken {
	public enum Kind {
		WORD,
		OPEN,
		CLOSE,
		SEMICOLON
	}
	private static final ConfToken open = new ConfToken(Kind.OPEN, "{");
	private static final ConfToken close = new ConfToken(Kind.CLOSE, "}");
	private static final ConfToken semicolon = new ConfToken(Kind.SEMICOLON, ";");
	private final Kind kind;
	public Kind kind() {
		return kind;
	}
	private final String text;
	public String text() {
		return text;
	}
	private ConfToken(Kind kind, String text) {
		this.kind = kind;
		this.text = text;
	}
	public static ConfToken word(String text) {
		Objects.requireNonNull(text);
		if (text.isEmpty())
			throw new IllegalArgumentException("Empty tokens are not allowed.");
		return new ConfToken(Kind.WORD, text);
	}
	public static ConfToken symbol(char symbol) {
		switch (symbol) {
			case '{':
				return open;
			case '}':
				return close;
			case ';':
				return semicolon;
			default:
				throw new IllegalArgumentException("Not a structural symbol: " + symbol);
		}
	}
	public boolean word() {
		return kind == Kind.WORD;
	}
	@Override public boolean equals(Object obj) {
		if (!(obj instanceof ConfToken))
			return false;
		ConfToken other = (ConfToken)obj;
		return kind == other.kind && text.equals(other.text);
	}
	@Override public int hashCode() {
		return Objects.hash(kind, text);
	}
	@Override public String toString() {
		return word() ? "'" + text + "'" : text;
	}
}
