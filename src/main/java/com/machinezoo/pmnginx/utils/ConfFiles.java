// Part of PMNginx
package com.machinezoo.pmnginx.utils;

import java.io.*;
import java.nio.file.*;
import java.nio.file.attribute.*;
import java.util.*;
import org.slf4j.*;
import com.google.common.collect.ImmutableSet;
import com.machinezoo.noexception.*;
import com.machinezoo.stagean.*;

/*
 * Finding the right nginx.conf in a workspace is non-trivial,
 * so let's concentrate all the logic in one class.
 */
/**
 * Locates configuration file and static file base directory within a workspace.
 */
@StubDocs
@DraftCode("designed for workspaces with a single relevant nginx.conf")
public class ConfFiles {
	private static final Logger logger = LoggerFactory.getLogger(ConfFiles.class);
	public static final String FILENAME = "nginx.conf";
	/*
	 * Build output and dependency folders often contain copies of nginx.conf that are not the one being edited.
	 */
	private static final Set<String> excluded = ImmutableSet.of("dist", "build", "out", ".git", "node_modules");
	private static final int MAX_MATCHES = 50;
	/*
	 * Relative paths are relative to the workspace. Absolute paths and paths without workspace are returned as they are.
	 */
	public static Path resolve(Path workspace, String path) {
		Path parsed = Paths.get(path.trim());
		if (workspace == null || parsed.isAbsolute())
			return parsed;
		return workspace.resolve(parsed);
	}
	/*
	 * Search order:
	 * - configured path if it exists
	 * - nginx.conf directly in the workspace
	 * - shortest path among nginx.conf files anywhere in the workspace
	 */
	public static Optional<Path> locate(Path workspace, String configured) {
		if (configured != null && !configured.trim().isEmpty()) {
			Path path = resolve(workspace, configured);
			if (Files.isReadable(path))
				return Optional.of(path);
			logger.debug("Configured path {} is not accessible, searching the workspace.", path);
		}
		if (workspace == null)
			return Optional.empty();
		Path direct = workspace.resolve(FILENAME);
		if (Files.isReadable(direct))
			return Optional.of(direct);
		return search(workspace).stream()
			.min(Comparator.comparingInt((Path p) -> p.toString().length()));
	}
	static List<Path> search(Path workspace) {
		var found = new ArrayList<Path>();
		if (!Files.isDirectory(workspace))
			return found;
		Exceptions.sneak().run(() -> Files.walkFileTree(workspace, new SimpleFileVisitor<Path>() {
			@Override public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
				Path name = dir.getFileName();
				if (!dir.equals(workspace) && name != null && excluded.contains(name.toString()))
					return FileVisitResult.SKIP_SUBTREE;
				return FileVisitResult.CONTINUE;
			}
			@Override public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
				if (attrs.isRegularFile() && FILENAME.equals(file.getFileName().toString())) {
					found.add(file);
					if (found.size() >= MAX_MATCHES)
						return FileVisitResult.TERMINATE;
				}
				return FileVisitResult.CONTINUE;
			}
			/*
			 * Unreadable folders are skipped. They cannot contain the config we are looking for.
			 */
			@Override public FileVisitResult visitFileFailed(Path file, IOException ex) {
				logger.debug("Skipping {} while searching for {}: {}", file, FILENAME, ex.getMessage());
				return FileVisitResult.CONTINUE;
			}
		}));
		return found;
	}
	/*
	 * Configured base directory wins. Otherwise the workspace and, without workspace, folder of the config file.
	 */
	public static Path baseDirectory(Path workspace, String configured, Path configFile) {
		if (configured != null && !configured.trim().isEmpty())
			return resolve(workspace, configured).toAbsolutePath().normalize();
		if (workspace != null)
			return workspace.toAbsolutePath().normalize();
		Path parent = configFile.toAbsolutePath().getParent();
		return parent != null ? parent : configFile.toAbsolutePath();
	}
	/*
	 * Settings are more portable when they store workspace-relative paths.
	 * Files outside of the workspace are kept absolute. Comparison ignores case like everywhere else.
	 */
	public static String relativize(Path workspace, Path file) {
		Path absolute = file.toAbsolutePath().normalize();
		if (workspace == null)
			return absolute.toString();
		Path root = workspace.toAbsolutePath().normalize();
		String rootText = root.toString().toLowerCase(Locale.ROOT);
		String fileText = absolute.toString().toLowerCase(Locale.ROOT);
		if (fileText.equals(rootText))
			return ".";
		String separator = root.getFileSystem().getSeparator();
		if (fileText.startsWith(rootText.endsWith(separator) ? rootText : rootText + separator))
			return root.relativize(absolute).toString();
		return absolute.toString();
	}
}
