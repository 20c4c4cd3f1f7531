// Part of PMNginx
package com.machinezoo.pmnginx;

import java.io.*;
import java.nio.file.*;
import java.nio.file.attribute.*;
import java.util.*;
import org.slf4j.*;
import com.machinezoo.stagean.*;

/*
 * Resolution order:
 * - proxy_pass wins without touching the filesystem
 * - regular file is served as is
 * - directory tries index files, then try_files
 * - missing path tries try_files
 *
 * Missing files are ordinary outcomes. Other filesystem errors (permissions, I/O) propagate as IOException.
 */
/**
 * Turns a matched {@link LocationRule} and a request path into a {@link RouteOutcome}.
 */
@StubDocs
@DraftCode("no support for $uri and other variables in try_files")
public class StaticResolver {
	private static final Logger logger = LoggerFactory.getLogger(StaticResolver.class);
	public static RouteOutcome resolve(ServerConfig config, LocationRule rule, String requestPath) throws IOException {
		Objects.requireNonNull(config);
		if (rule != null && rule.proxied())
			return RouteOutcome.proxy(rule.proxyTarget().get());
		Path root = root(config, rule);
		var resolved = SafePaths.resolve(root, requestPath);
		if (resolved.isEmpty())
			return RouteOutcome.forbidden();
		Path path = resolved.get();
		var attributes = stat(path);
		if (attributes.isPresent() && attributes.get().isRegularFile())
			return serve(path);
		if (attributes.isPresent() && attributes.get().isDirectory()) {
			for (String index : config.indexFiles()) {
				var candidate = SafePaths.resolve(path, index);
				if (candidate.isPresent() && regular(candidate.get()))
					return serve(candidate.get());
			}
			return tryFiles(root, rule).orElseGet(RouteOutcome::missingIndex);
		}
		return tryFiles(root, rule).orElseGet(RouteOutcome::notFound);
	}
	public static RouteOutcome resolve(ServerConfig config, String requestPath) throws IOException {
		return resolve(config, LocationMatcher.match(config, requestPath).orElse(null), requestPath);
	}
	/*
	 * Location root is resolved on every request, because it is kept unresolved in the rule.
	 */
	public static Path root(ServerConfig config, LocationRule rule) {
		if (rule != null && rule.rootOverride().isPresent())
			return ServerConfigs.resolve(config.baseDirectory(), rule.rootOverride().get());
		return config.documentRoot();
	}
	/*
	 * Only entries starting with slash are files. Entries like $uri or =404 are skipped.
	 */
	private static Optional<RouteOutcome> tryFiles(Path root, LocationRule rule) throws IOException {
		if (rule == null || rule.tryFiles().isEmpty())
			return Optional.empty();
		for (String entry : rule.tryFiles().get()) {
			if (!entry.startsWith("/"))
				continue;
			var candidate = SafePaths.resolve(root, entry);
			if (candidate.isPresent() && regular(candidate.get())) {
				logger.debug("Falling back to {} for {}.", entry, rule);
				return Optional.of(serve(candidate.get()));
			}
		}
		return Optional.empty();
	}
	private static RouteOutcome serve(Path path) {
		return RouteOutcome.serve(path, MimeTypes.of(path));
	}
	private static boolean regular(Path path) throws IOException {
		return stat(path).map(BasicFileAttributes::isRegularFile).orElse(false);
	}
	private static Optional<BasicFileAttributes> stat(Path path) throws IOException {
		try {
			return Optional.of(Files.readAttributes(path, BasicFileAttributes.class));
		} catch (NoSuchFileException | NotDirectoryException ex) {
			return Optional.empty();
		} catch (FileSystemException ex) {
			/*
			 * Path like /file.txt/x fails with ENOTDIR, which is reported only through the reason text.
			 */
			if ("Not a directory".equals(ex.getReason()))
				return Optional.empty();
			throw ex;
		}
	}
}
