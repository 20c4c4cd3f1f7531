// Part of PMNginx
package com.machinezoo.pmnginx;

import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/*
 * There are exactly two kinds of nodes. The private constructor keeps the hierarchy closed
 * and match() forces every consumer to handle both of them.
 */
/**
 * Node of the configuration syntax tree, either {@link Directive} or {@link Block}.
 */
@StubDocs
public abstract class ConfNode {
	private final String name;
	public String name() {
		return name;
	}
	private final List<String> args;
	public List<String> args() {
		return args;
	}
	private ConfNode(String name, List<String> args) {
		Objects.requireNonNull(name);
		this.name = name;
		this.args = List.copyOf(args);
	}
	public abstract <T> T match(Function<Directive, T> directive, Function<Block, T> block);
	public static final class Directive extends ConfNode {
		public Directive(String name, List<String> args) {
			super(name, args);
		}
		@Override public <T> T match(Function<Directive, T> directive, Function<Block, T> block) {
			return directive.apply(this);
		}
		@Override public boolean equals(Object obj) {
			if (!(obj instanceof Directive))
				return false;
			Directive other = (Directive)obj;
			return name().equals(other.name()) && args().equals(other.args());
		}
		@Override public int hashCode() {
			return Objects.hash(name(), args());
		}
		@Override public String toString() {
			return String.join(" ", prefix()) + ";";
		}
	}
	public static final class Block extends ConfNode {
		private final List<ConfNode> children;
		public List<ConfNode> children() {
			return children;
		}
		public Block(String name, List<String> args, List<ConfNode> children) {
			super(name, args);
			this.children = List.copyOf(children);
		}
		@Override public <T> T match(Function<Directive, T> directive, Function<Block, T> block) {
			return block.apply(this);
		}
		@Override public boolean equals(Object obj) {
			if (!(obj instanceof Block))
				return false;
			Block other = (Block)obj;
			return name().equals(other.name()) && args().equals(other.args()) && children.equals(other.children);
		}
		@Override public int hashCode() {
			return Objects.hash(name(), args(), children);
		}
		@Override public String toString() {
			return String.join(" ", prefix()) + " { " + children.size() + " children }";
		}
	}
	List<String> prefix() {
		var parts = new ArrayList<String>();
		parts.add(name);
		parts.addAll(args);
		return parts;
	}
}
