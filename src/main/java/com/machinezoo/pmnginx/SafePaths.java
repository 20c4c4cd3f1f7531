// Part of PMNginx
package com.machinezoo.pmnginx;

import java.nio.file.*;
import java.util.*;
import org.eclipse.jetty.util.URIUtil;
import org.slf4j.*;
import com.google.common.base.Splitter;
import com.machinezoo.stagean.*;

/*
 * This is the only thing standing between request paths and the rest of the filesystem.
 * Every request path and every try_files candidate goes through here before it touches the disk.
 */
/**
 * Maps request paths to files under a root directory without ever leaving the root.
 */
@StubDocs
public class SafePaths {
	private static final Logger logger = LoggerFactory.getLogger(SafePaths.class);
	/*
	 * Request paths are decoded exactly once. Files may have percent signs in their names.
	 * Further rounds are only inspected for hidden traversal. The limit stops pathological inputs.
	 */
	private static final int MAX_DECODING_ROUNDS = 4;
	private static final Splitter segmenter = Splitter.on('/').omitEmptyStrings();
	public static Optional<Path> resolve(Path root, String requestPath) {
		Objects.requireNonNull(root);
		String decoded = decode(requestPath == null || requestPath.isEmpty() ? "/" : requestPath);
		if (decoded == null || decoded.indexOf('\0') >= 0 || hidesTraversal(decoded))
			return reject(requestPath);
		var segments = new ArrayDeque<String>();
		for (String segment : segmenter.split(decoded.replace('\\', '/'))) {
			if (segment.equals("."))
				continue;
			if (segment.equals("..")) {
				/*
				 * Climbing above the root is rejected outright instead of being clamped at the root.
				 */
				if (segments.isEmpty())
					return reject(requestPath);
				segments.removeLast();
			} else
				segments.addLast(segment);
		}
		Path resolvedRoot = root.toAbsolutePath().normalize();
		Path candidate = resolvedRoot;
		try {
			for (String segment : segments)
				candidate = candidate.resolve(segment);
		} catch (InvalidPathException ex) {
			return reject(requestPath);
		}
		candidate = candidate.toAbsolutePath().normalize();
		if (!within(resolvedRoot, candidate))
			return reject(requestPath);
		return Optional.of(candidate);
	}
	/*
	 * Comparison ignores case, because the tool is mostly used on case-insensitive filesystems.
	 */
	static boolean within(Path root, Path candidate) {
		String rootText = root.toString().toLowerCase(Locale.ROOT);
		String candidateText = candidate.toString().toLowerCase(Locale.ROOT);
		if (candidateText.equals(rootText))
			return true;
		String separator = root.getFileSystem().getSeparator();
		String prefix = rootText.endsWith(separator) ? rootText : rootText + separator;
		return candidateText.startsWith(prefix);
	}
	/*
	 * Returns null for malformed escapes.
	 */
	private static String decode(String path) {
		if (path.indexOf('%') < 0)
			return path;
		try {
			return URIUtil.decodePath(path);
		} catch (IllegalArgumentException | IndexOutOfBoundsException ex) {
			logger.debug("Malformed percent encoding in {}: {}", path, ex.getMessage());
			return null;
		}
	}
	/*
	 * Double-encoded dots or NUL would turn into traversal in any component that decodes the path again.
	 * Text that cannot be decoded any further is a literal file name.
	 */
	private static boolean hidesTraversal(String decoded) {
		String current = decoded;
		for (int round = 1; round < MAX_DECODING_ROUNDS && current.indexOf('%') >= 0; ++round) {
			String next = decode(current);
			if (next == null || next.equals(current))
				return false;
			if (next.indexOf('\0') >= 0)
				return true;
			for (String segment : segmenter.split(next.replace('\\', '/')))
				if (segment.equals(".."))
					return true;
			current = next;
		}
		return false;
	}
	private static Optional<Path> reject(String requestPath) {
		logger.debug("Rejected path outside of root: {}", requestPath);
		return Optional.empty();
	}
}
