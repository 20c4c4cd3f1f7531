// Part of PMNginx
package com.machinezoo.pmnginx;

import java.nio.file.*;
import java.util.*;
import com.machinezoo.stagean.*;

/**
 * Terminal decision for one request, produced by {@link StaticResolver}.
 */
@StubDocs
public final class RouteOutcome {
	public enum Kind {
		SERVE(200),
		PROXY(200),
		NOT_FOUND(404),
		FORBIDDEN(403);
		private final int status;
		Kind(int status) {
			this.status = status;
		}
		public int status() {
			return status;
		}
	}
	private final Kind kind;
	public Kind kind() {
		return kind;
	}
	private final Path file;
	public Optional<Path> file() {
		return Optional.ofNullable(file);
	}
	private final String contentType;
	public Optional<String> contentType() {
		return Optional.ofNullable(contentType);
	}
	private final String target;
	public Optional<String> target() {
		return Optional.ofNullable(target);
	}
	/*
	 * Human-readable explanation that ends up in the response body.
	 */
	private final String message;
	public String message() {
		return message;
	}
	private RouteOutcome(Kind kind, Path file, String contentType, String target, String message) {
		this.kind = kind;
		this.file = file;
		this.contentType = contentType;
		this.target = target;
		this.message = message;
	}
	public static RouteOutcome serve(Path file, String contentType) {
		Objects.requireNonNull(file);
		Objects.requireNonNull(contentType);
		return new RouteOutcome(Kind.SERVE, file, contentType, null, "200 OK");
	}
	public static RouteOutcome proxy(String target) {
		Objects.requireNonNull(target);
		return new RouteOutcome(Kind.PROXY, null, null, target, "[Mock] Matched proxy location: " + target);
	}
	public static RouteOutcome notFound() {
		return new RouteOutcome(Kind.NOT_FOUND, null, null, null, "404 Not Found");
	}
	public static RouteOutcome missingIndex() {
		return new RouteOutcome(Kind.NOT_FOUND, null, null, null, "404 Not Found (Directory index not found)");
	}
	public static RouteOutcome forbidden() {
		return new RouteOutcome(Kind.FORBIDDEN, null, null, null, "403 Forbidden");
	}
	public int status() {
		return kind.status();
	}
	@Override public boolean equals(Object obj) {
		if (!(obj instanceof RouteOutcome))
			return false;
		RouteOutcome other = (RouteOutcome)obj;
		return kind == other.kind
			&& Objects.equals(file, other.file)
			&& Objects.equals(contentType, other.contentType)
			&& Objects.equals(target, other.target)
			&& message.equals(other.message);
	}
	@Override public int hashCode() {
		return Objects.hash(kind, file, contentType, target, message);
	}
	@Override public String toString() {
		switch (kind) {
			case SERVE:
				return "SERVE " + file + " (" + contentType + ")";
			case PROXY:
				return "PROXY " + target;
			default:
				return kind.name() + ": " + message;
		}
	}
}
