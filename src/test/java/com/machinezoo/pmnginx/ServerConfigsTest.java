// Part of PMNginx
package com.machinezoo.pmnginx;

import static org.junit.jupiter.api.Assertions.*;
import java.nio.file.*;
import java.util.*;
import org.junit.jupiter.api.*;

public class ServerConfigsTest {
	private final Path base = Paths.get("workspace").toAbsolutePath().normalize();
	private ServerConfig build(String conf) {
		return ServerConfigs.build(conf, base).get();
	}
	@Test public void roundTrip() {
		var config = build("server { listen 8080; root \"a b\"; location /x { try_files /a.html /b.html; } }");
		assertEquals(8080, config.listenPort());
		assertTrue(config.documentRoot().toString().endsWith("a b"));
		assertEquals(base.resolve("a b"), config.documentRoot());
		assertEquals(1, config.locations().size());
		var location = config.locations().get(0);
		assertEquals(LocationKind.PREFIX, location.kind());
		assertEquals("/x", location.matcher());
		assertFalse(location.stopOnMatch());
		assertEquals(Optional.of(List.of("/a.html", "/b.html")), location.tryFiles());
	}
	@Test public void firstServerInFirstHttp() {
		var config = build(String.join("\n",
			"events { }",
			"http {",
			"  server { listen 81; }",
			"  server { listen 82; }",
			"}",
			"http { server { listen 83; } }"));
		assertEquals(81, config.listenPort());
	}
	@Test public void missingServer() {
		assertTrue(ServerConfigs.build("", base).isEmpty());
		assertTrue(ServerConfigs.build("events { worker_connections 1024; }", base).isEmpty());
		assertTrue(ServerConfigs.build("http { include mime.types; }", base).isEmpty());
		/*
		 * When http block exists, top-level server block is not considered.
		 */
		assertTrue(ServerConfigs.build("http { } server { listen 81; }", base).isEmpty());
	}
	@Test public void defaults() {
		var config = build("http { server { } }");
		assertEquals(80, config.listenPort());
		assertEquals(base, config.documentRoot());
		assertEquals(base, config.baseDirectory());
		assertEquals(List.of("index.html", "index.htm"), config.indexFiles());
		assertTrue(config.locations().isEmpty());
	}
	@Test public void listen() {
		assertEquals(8080, ServerConfigs.port(List.of("8080")));
		assertEquals(8081, ServerConfigs.port(List.of("127.0.0.1:8081")));
		assertEquals(8082, ServerConfigs.port(List.of("[::]:8082", "default_server")));
		assertEquals(80, ServerConfigs.port(List.of("localhost")));
		assertEquals(80, ServerConfigs.port(List.of("unix:/var/run/nginx.sock")));
		assertEquals(80, ServerConfigs.port(List.of()));
		assertEquals(80, ServerConfigs.port(List.of("0")));
		assertEquals(80, ServerConfigs.port(List.of("70000")));
		assertEquals(80, ServerConfigs.port(List.of("99999999999999999999")));
	}
	@Test public void root() {
		assertEquals(base.resolve("dist"), build("server { root ./dist/; }").documentRoot());
		assertEquals(base.getParent().resolve("site"), build("server { root ../site; }").documentRoot());
		Path absolute = base.getRoot().resolve("srv").resolve("www");
		assertEquals(absolute, build("server { root " + absolute + "; }").documentRoot());
	}
	@Test public void index() {
		assertEquals(List.of("main.html", "index.php"), build("server { index main.html index.php; }").indexFiles());
		assertEquals(List.of("index.html", "index.htm"), build("server { index; }").indexFiles());
		assertEquals(List.of("first.html"), build("server { index first.html; index second.html; }").indexFiles());
	}
	@Test public void modifiers() {
		var locations = build(String.join("\n",
			"server {",
			"  location = /health { }",
			"  location ~ \\.php$ { }",
			"  location ~* \\.PNG$ { }",
			"  location ^~ /static/ { }",
			"  location /api { }",
			"  location { }",
			"  location = { }",
			"  location ~ { }",
			"  location ^~ { }",
			"}")).locations();
		assertEquals(9, locations.size());
		assertEquals(LocationKind.EXACT, locations.get(0).kind());
		assertEquals("/health", locations.get(0).matcher());
		assertEquals(LocationKind.REGEX, locations.get(1).kind());
		assertFalse(locations.get(1).caseInsensitive());
		assertTrue(locations.get(1).pattern().isPresent());
		assertTrue(locations.get(2).caseInsensitive());
		assertTrue(locations.get(2).pattern().get().matcher("/img/a.png").find());
		assertEquals(LocationKind.PREFIX, locations.get(3).kind());
		assertTrue(locations.get(3).stopOnMatch());
		assertEquals("/static/", locations.get(3).matcher());
		assertFalse(locations.get(4).stopOnMatch());
		assertEquals("/api", locations.get(4).matcher());
		assertEquals("/", locations.get(5).matcher());
		assertEquals("/", locations.get(6).matcher());
		assertEquals(LocationKind.EXACT, locations.get(6).kind());
		assertEquals("", locations.get(7).matcher());
		assertEquals("/", locations.get(8).matcher());
		assertTrue(locations.get(8).stopOnMatch());
	}
	@Test public void locationDirectives() {
		var locations = build(String.join("\n",
			"server {",
			"  location /api/ { proxy_pass http://127.0.0.1:3000; proxy_pass http://ignored; }",
			"  location /docs { root ../docs; try_files $uri /index.html =404; }",
			"  location /empty { try_files; proxy_pass; }",
			"  location /nested { if ($x) { proxy_pass http://nested; } }",
			"}")).locations();
		assertEquals(Optional.of("http://127.0.0.1:3000"), locations.get(0).proxyTarget());
		assertTrue(locations.get(0).proxied());
		assertEquals(Optional.of("../docs"), locations.get(1).rootOverride());
		assertEquals(Optional.of(List.of("$uri", "/index.html", "=404")), locations.get(1).tryFiles());
		assertTrue(locations.get(2).tryFiles().isEmpty());
		assertTrue(locations.get(2).proxyTarget().isEmpty());
		assertTrue(locations.get(3).proxyTarget().isEmpty());
	}
	@Test public void locationsKeepSourceOrder() {
		var locations = build("server { location /b { } location /a { } location = /c { } }").locations();
		assertEquals("/b", locations.get(0).matcher());
		assertEquals("/a", locations.get(1).matcher());
		assertEquals("/c", locations.get(2).matcher());
	}
	@Test public void invalidRegex() {
		var ex = assertThrows(NginxConfigException.class, () -> ServerConfigs.build("server { location ~ ([a-z { } }", base));
		assertTrue(ex.getMessage().contains("([a-z"));
	}
	@Test public void partialConfig() {
		var config = build("http { server { listen 9000; location /a { root x;");
		assertEquals(9000, config.listenPort());
		assertEquals(1, config.locations().size());
		assertEquals(Optional.of("x"), config.locations().get(0).rootOverride());
	}
	@Test public void frozen() {
		var location = build("server { location / { } }").locations().get(0);
		assertThrows(IllegalStateException.class, () -> location.proxyTarget("http://x"));
	}
	@Test public void byteOrderMark() {
		assertEquals(8080, build("\uFEFFhttp { server { listen 8080; } }").listenPort());
	}
}
