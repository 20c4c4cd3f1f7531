// Part of PMNginx
package com.machinezoo.pmnginx;

import java.util.*;
import java.util.regex.*;
import com.machinezoo.stagean.*;

/*
 * Rules are mutable while ServerConfigs builds them and frozen afterwards.
 * Volatile to ensure freezing is observed by request threads.
 */
/**
 * Single {@code location} block of the server configuration.
 */
@StubDocs
public class LocationRule {
	private volatile boolean frozen;
	private void modify() {
		if (frozen)
			throw new IllegalStateException("Cannot modify frozen location: " + label());
	}
	public LocationRule freeze() {
		frozen = true;
		return this;
	}
	private final LocationKind kind;
	public LocationKind kind() {
		return kind;
	}
	private final String matcher;
	public String matcher() {
		return matcher;
	}
	private final boolean caseInsensitive;
	public boolean caseInsensitive() {
		return caseInsensitive;
	}
	/*
	 * Only prefix rules declared with ^~ stop the regex scan.
	 */
	private final boolean stopOnMatch;
	public boolean stopOnMatch() {
		return stopOnMatch;
	}
	private final Pattern pattern;
	public Optional<Pattern> pattern() {
		return Optional.ofNullable(pattern);
	}
	private LocationRule(LocationKind kind, String matcher, boolean caseInsensitive, boolean stopOnMatch, Pattern pattern) {
		this.kind = kind;
		this.matcher = matcher;
		this.caseInsensitive = caseInsensitive;
		this.stopOnMatch = stopOnMatch;
		this.pattern = pattern;
	}
	public static LocationRule exact(String matcher) {
		Objects.requireNonNull(matcher);
		return new LocationRule(LocationKind.EXACT, matcher, false, false, null);
	}
	public static LocationRule prefix(String matcher, boolean stopOnMatch) {
		Objects.requireNonNull(matcher);
		return new LocationRule(LocationKind.PREFIX, matcher, false, stopOnMatch, null);
	}
	public static LocationRule regex(String matcher, boolean caseInsensitive) {
		Objects.requireNonNull(matcher);
		Pattern pattern;
		try {
			pattern = Pattern.compile(matcher, caseInsensitive ? Pattern.CASE_INSENSITIVE : 0);
		} catch (PatternSyntaxException ex) {
			throw new NginxConfigException("Invalid regular expression in location: " + matcher, ex);
		}
		return new LocationRule(LocationKind.REGEX, matcher, caseInsensitive, false, pattern);
	}
	private String proxyTarget;
	public Optional<String> proxyTarget() {
		return Optional.ofNullable(proxyTarget);
	}
	public LocationRule proxyTarget(String proxyTarget) {
		modify();
		this.proxyTarget = proxyTarget;
		return this;
	}
	/*
	 * Kept exactly as written in the configuration. StaticResolver resolves it against the base directory per request.
	 */
	private String rootOverride;
	public Optional<String> rootOverride() {
		return Optional.ofNullable(rootOverride);
	}
	public LocationRule rootOverride(String rootOverride) {
		modify();
		this.rootOverride = rootOverride;
		return this;
	}
	private List<String> tryFiles;
	public Optional<List<String>> tryFiles() {
		return Optional.ofNullable(tryFiles);
	}
	public LocationRule tryFiles(List<String> tryFiles) {
		modify();
		/*
		 * Empty list means there is no try_files at all.
		 */
		this.tryFiles = tryFiles == null || tryFiles.isEmpty() ? null : List.copyOf(tryFiles);
		return this;
	}
	public boolean proxied() {
		return proxyTarget != null;
	}
	/*
	 * Short form of the rule for log lines, e.g. "= /health" or "~* \.png$".
	 */
	public String label() {
		switch (kind) {
			case EXACT:
				return "= " + matcher;
			case REGEX:
				return (caseInsensitive ? "~* " : "~ ") + matcher;
			case PREFIX:
			default:
				return stopOnMatch ? "^~ " + matcher : matcher;
		}
	}
	@Override public String toString() {
		return "location " + label();
	}
}
