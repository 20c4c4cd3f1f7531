// Part of PMNginx
package com.machinezoo.pmnginx;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Precedence:
 * 1. exact match, first one in source order
 * 2. longest prefix if it was declared with ^~
 * 3. first matching regex in declaration order
 * 4. longest prefix
 *
 * Regexes are scanned in declaration order, not by specificity, so an earlier broad regex shadows later ones.
 * Equally long prefixes are resolved in favor of the first one.
 */
/**
 * Picks the {@link LocationRule} that handles a request path.
 */
@StubDocs
public class LocationMatcher {
	public static Optional<LocationRule> match(List<LocationRule> locations, String path) {
		Objects.requireNonNull(path);
		for (var location : locations)
			if (location.kind() == LocationKind.EXACT && location.matcher().equals(path))
				return Optional.of(location);
		LocationRule prefix = null;
		for (var location : locations) {
			if (location.kind() == LocationKind.PREFIX && path.startsWith(location.matcher())) {
				if (prefix == null || location.matcher().length() > prefix.matcher().length())
					prefix = location;
			}
		}
		if (prefix != null && prefix.stopOnMatch())
			return Optional.of(prefix);
		for (var location : locations)
			if (location.kind() == LocationKind.REGEX && location.pattern().get().matcher(path).find())
				return Optional.of(location);
		return Optional.ofNullable(prefix);
	}
	public static Optional<LocationRule> match(ServerConfig config, String path) {
		return match(config.locations(), path);
	}
}
