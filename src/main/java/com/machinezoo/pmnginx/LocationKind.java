// Part of PMNginx
package com.machinezoo.pmnginx;

/*
 * Precedence is not the declaration order here. It is implemented in LocationMatcher.
 */
public enum LocationKind {
	EXACT,
	PREFIX,
	REGEX
}
