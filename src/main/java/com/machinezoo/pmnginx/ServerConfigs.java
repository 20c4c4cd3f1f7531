// Part of PMNginx
package com.machinezoo.pmnginx;

import static java.util.stream.Collectors.*;
import java.nio.file.*;
import java.util.*;
import java.util.regex.*;
import org.slf4j.*;
import com.google.common.primitives.*;
import com.machinezoo.stagean.*;

/*
 * Missing blocks and directives are normal. Only the server block itself is required
 * and even its absence is reported as an empty Optional rather than an exception.
 * The only failure is an invalid regular expression in some location.
 */
/**
 * Converts {@link ConfTree} into {@link ServerConfig}.
 */
@StubDocs
public class ServerConfigs {
	private static final Logger logger = LoggerFactory.getLogger(ServerConfigs.class);
	public static Optional<ServerConfig> build(ConfTree tree, Path baseDirectory) {
		Objects.requireNonNull(tree);
		Path base = baseDirectory.toAbsolutePath().normalize();
		if (tree.partial())
			logger.debug("Configuration is malformed, using whatever could be parsed (balanced = {}, complete = {}).", tree.balanced(), tree.complete());
		return server(tree.nodes()).map(server -> build(server, base));
	}
	public static Optional<ServerConfig> build(String text, Path baseDirectory) {
		return build(ConfParser.parse(text), baseDirectory);
	}
	/*
	 * Snippets without the http wrapper are common in examples, so top-level server block is accepted too.
	 * When http block exists, the server must be inside it.
	 */
	private static Optional<ConfNode.Block> server(List<ConfNode> root) {
		var http = ConfQuery.block(root, "http");
		if (http.isPresent())
			return ConfQuery.block(http.get().children(), "server");
		return ConfQuery.block(root, "server");
	}
	private static ServerConfig build(ConfNode.Block server, Path base) {
		var children = server.children();
		int port = ConfQuery.directive(children, "listen")
			.map(d -> port(d.args()))
			.orElse(ServerConfig.DEFAULT_PORT);
		Path root = ConfQuery.argument(children, "root")
			.filter(r -> !r.trim().isEmpty())
			.map(r -> resolve(base, r))
			.orElse(base);
		List<String> index = ConfQuery.directive(children, "index")
			.map(d -> cleanup(d.args()))
			.filter(l -> !l.isEmpty())
			.orElse(ServerConfig.DEFAULT_INDEX);
		List<LocationRule> locations = ConfQuery.blocks(children, "location").stream()
			.map(ServerConfigs::location)
			.collect(toList());
		logger.debug("Server configuration: port {}, root {}, {} locations.", port, root, locations.size());
		return new ServerConfig(port, root, base, index, locations);
	}
	private static final Pattern hostPortRe = Pattern.compile(":(\\d+)$");
	private static final Pattern portRe = Pattern.compile("^\\d+$");
	static int port(List<String> args) {
		if (args.isEmpty())
			return ServerConfig.DEFAULT_PORT;
		String address = args.get(0);
		String digits = null;
		Matcher matcher = hostPortRe.matcher(address);
		if (matcher.find())
			digits = matcher.group(1);
		else if (portRe.matcher(address).matches())
			digits = address;
		if (digits == null)
			return ServerConfig.DEFAULT_PORT;
		/*
		 * Overflow yields null here. Zero and ports above 65535 are not usable either.
		 */
		Integer port = Ints.tryParse(digits);
		if (port == null || port < 1 || port > 65535)
			return ServerConfig.DEFAULT_PORT;
		return port;
	}
	static Path resolve(Path base, String path) {
		try {
			return base.resolve(path).toAbsolutePath().normalize();
		} catch (InvalidPathException ex) {
			throw new NginxConfigException("Invalid path: " + path, ex);
		}
	}
	private static List<String> cleanup(List<String> args) {
		return args.stream()
			.map(String::trim)
			.filter(s -> !s.isEmpty())
			.collect(toList());
	}
	private static LocationRule location(ConfNode.Block block) {
		var args = block.args();
		String modifier = args.isEmpty() ? "" : args.get(0);
		String next = args.size() > 1 ? args.get(1) : null;
		LocationRule rule;
		switch (modifier) {
			case "=":
				rule = LocationRule.exact(next != null ? next : "/");
				break;
			case "~":
				rule = LocationRule.regex(next != null ? next : "", false);
				break;
			case "~*":
				rule = LocationRule.regex(next != null ? next : "", true);
				break;
			case "^~":
				rule = LocationRule.prefix(next != null ? next : "/", true);
				break;
			default:
				rule = LocationRule.prefix(args.isEmpty() ? "/" : modifier, false);
				break;
		}
		var children = block.children();
		return rule
			.proxyTarget(ConfQuery.argument(children, "proxy_pass").orElse(null))
			.rootOverride(ConfQuery.argument(children, "root").orElse(null))
			.tryFiles(ConfQuery.directive(children, "try_files")
				.map(d -> cleanup(d.args()))
				.orElse(null));
	}
}
