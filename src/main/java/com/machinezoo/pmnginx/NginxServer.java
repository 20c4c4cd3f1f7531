// Part of PMNginx
package com.machinezoo.pmnginx;

import java.io.*;
import java.net.*;
import java.nio.charset.*;
import java.nio.file.*;
import java.util.*;
import javax.servlet.http.*;
import org.apache.commons.io.IOUtils;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.AbstractHandler;
import org.eclipse.jetty.util.BlockingArrayQueue;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.*;
import com.google.common.base.Throwables;
import com.machinezoo.noexception.*;
import com.machinezoo.pmnginx.utils.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;

/*
 * Every start reads nginx.conf again and builds fresh ServerConfig.
 * There is no hot swap. Restart stops the old jetty server completely before the new configuration is built.
 * All lifecycle methods are synchronized, so there is at most one current configuration.
 */
/**
 * Local HTTP server that routes requests according to nginx.conf via embedded jetty server.
 */
@StubDocs
@DraftApi
public class NginxServer {
	private static final Logger logger = LoggerFactory.getLogger(NginxServer.class);
	private final NginxSettings settings;
	public NginxServer(NginxSettings settings) {
		Objects.requireNonNull(settings);
		this.settings = settings;
	}
	private Server server;
	private LiveConnections connections;
	private ServerConfig config;
	public synchronized Optional<ServerConfig> config() {
		return Optional.ofNullable(config);
	}
	private Path configFile;
	public synchronized Optional<Path> configFile() {
		return Optional.ofNullable(configFile);
	}
	private int port;
	/*
	 * Actual port, which differs from the configured one when port 0 was requested.
	 */
	public synchronized int port() {
		return port;
	}
	public synchronized boolean running() {
		return server != null;
	}
	synchronized int liveConnections() {
		return connections != null ? connections.size() : 0;
	}
	private void emit(String line) {
		logger.info(line);
		Exceptions.log(logger).run(() -> settings.log().accept(line));
	}
	private ServerConfig load(Path file, Path base) {
		String text;
		try {
			text = Files.readString(file, StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new NginxConfigException("Failed to read " + file + ": " + ex.getMessage(), ex);
		}
		return ServerConfigs.build(text, base)
			.orElseThrow(() -> new NginxConfigException("No valid http/server block found in " + file + "."));
	}
	public synchronized NginxServer start() {
		if (server != null) {
			logger.warn("Server is already running on port {}.", port);
			return this;
		}
		Path file = ConfFiles.locate(settings.workspace(), settings.configFile())
			.orElseThrow(() -> new NginxConfigException("No " + ConfFiles.FILENAME + " found. Place one in the workspace or configure its path."));
		Path base = ConfFiles.baseDirectory(settings.workspace(), settings.baseDirectory(), file);
		ServerConfig loaded = load(file, base);
		int requested = settings.port() != 0 ? settings.port() : loaded.listenPort();
		String host = settings.host();
		emit("Starting server...");
		emit("- Configuration: " + ConfFiles.relativize(settings.workspace(), file));
		emit("- Base directory: " + base);
		emit("- Listening on: http://" + host + ":" + requested);
		var queue = new BlockingArrayQueue<Runnable>(128, 128, 10_000);
		var executor = new QueuedThreadPool(16, 2, 60_000, queue);
		executor.setName(NginxServer.class.getSimpleName());
		executor.setDaemon(true);
		var jetty = new Server(executor);
		var tracked = new LiveConnections();
		var connector = new ServerConnector(jetty, new HttpConnectionFactory());
		connector.setHost(host);
		connector.setPort(requested);
		connector.addBean(tracked.listener());
		jetty.addConnector(connector);
		jetty.setHandler(new RouteHandler(loaded));
		try {
			jetty.start();
		} catch (Exception ex) {
			/*
			 * Jetty may have started some of its components. Stop them all before reporting the failure.
			 */
			tracked.terminateAll();
			Exceptions.log(logger).run(Exceptions.sneak().runnable(jetty::stop));
			NginxListenException failure = listenFailure(requested, ex);
			emit("[fatal] " + failure.getMessage());
			throw failure;
		}
		server = jetty;
		connections = tracked;
		config = loaded;
		configFile = file;
		port = connector.getLocalPort();
		emit("[ready] Server is listening on http://" + host + ":" + port);
		return this;
	}
	private static NginxListenException listenFailure(int port, Exception ex) {
		boolean inUse = Throwables.getCausalChain(ex).stream().anyMatch(t -> t instanceof BindException);
		if (inUse)
			return new NginxListenException("Port " + port + " is already in use.", ex);
		return new NginxListenException("Failed to start server on port " + port + ": " + ex.getMessage(), ex);
	}
	public synchronized void stop() {
		if (server == null)
			return;
		/*
		 * Close connections first. Idle keep-alive connections would otherwise delay the stop.
		 */
		connections.terminateAll();
		try {
			server.stop();
		} catch (Exception ex) {
			logger.error("Error while stopping server.", ex);
		}
		server = null;
		connections = null;
		config = null;
		port = 0;
		emit("Server stopped.");
	}
	public synchronized NginxServer restart() {
		stop();
		return start();
	}
	private static final Timer timer = Metrics.timer("http.request");
	/*
	 * Handler holds the configuration it was created with. Restart creates new handler.
	 */
	private class RouteHandler extends AbstractHandler {
		final ServerConfig config;
		RouteHandler(ServerConfig config) {
			this.config = config;
		}
		@Override public void handle(String target, Request baseRequest, HttpServletRequest request, HttpServletResponse response) throws IOException {
			baseRequest.setHandled(true);
			var sample = Timer.start(Clock.SYSTEM);
			String path = request.getRequestURI();
			try {
				var rule = LocationMatcher.match(config, path);
				emit(request.getMethod() + " " + path + " -> " + rule.map(LocationRule::label).orElse("default"));
				var outcome = StaticResolver.resolve(config, rule.orElse(null), path);
				respond(outcome, response);
			} catch (IOException | RuntimeException ex) {
				logger.error("Failed to handle {} {}.", request.getMethod(), path, ex);
				emit("[error] Failed to handle request: " + ex.getMessage());
				if (!response.isCommitted()) {
					response.reset();
					text(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "500 Internal Server Error");
				}
			} finally {
				sample.stop(timer);
			}
		}
	}
	private void respond(RouteOutcome outcome, HttpServletResponse response) throws IOException {
		switch (outcome.kind()) {
			case SERVE:
				Path file = outcome.file().get();
				response.setStatus(HttpServletResponse.SC_OK);
				response.setContentType(outcome.contentType().get());
				response.setContentLengthLong(Files.size(file));
				try (InputStream stream = Files.newInputStream(file)) {
					IOUtils.copy(stream, response.getOutputStream());
				}
				break;
			case PROXY:
				emit("[proxy] Forwarding to " + outcome.target().get() + " (mock response only)");
				text(response, outcome.status(), outcome.message());
				break;
			case NOT_FOUND:
			case FORBIDDEN:
			default:
				text(response, outcome.status(), outcome.message());
				break;
		}
	}
	private static void text(HttpServletResponse response, int status, String body) throws IOException {
		byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
		response.setStatus(status);
		response.setContentType("text/plain; charset=utf-8");
		response.setContentLength(bytes.length);
		response.getOutputStream().write(bytes);
	}
}
