// Part of PMNginx
package com.machinezoo.pmnginx;

import java.nio.file.*;
import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/*
 * Settings come from the host (editor, command line, tests). All of them are optional.
 * NginxServer reads them on every start, so changes take effect on the next restart.
 */
/**
 * Host-provided settings of {@link NginxServer}.
 */
@StubDocs
@DraftApi
public class NginxSettings {
	/*
	 * Relative paths in other settings are resolved against the workspace.
	 */
	private Path workspace;
	public Path workspace() {
		return workspace;
	}
	public NginxSettings workspace(Path workspace) {
		this.workspace = workspace;
		return this;
	}
	/*
	 * Path to nginx.conf. When empty or inaccessible, the workspace is searched.
	 */
	private String configFile;
	public String configFile() {
		return configFile;
	}
	public NginxSettings configFile(String configFile) {
		this.configFile = configFile;
		return this;
	}
	/*
	 * Static files are served relative to this directory. Defaults to the workspace.
	 */
	private String baseDirectory;
	public String baseDirectory() {
		return baseDirectory;
	}
	public NginxSettings baseDirectory(String baseDirectory) {
		this.baseDirectory = baseDirectory;
		return this;
	}
	private String host = "0.0.0.0";
	public String host() {
		return host;
	}
	public NginxSettings host(String host) {
		Objects.requireNonNull(host);
		this.host = host.trim().isEmpty() ? "0.0.0.0" : host.trim();
		return this;
	}
	/*
	 * Zero means the port from the listen directive.
	 */
	private int port;
	public int port() {
		return port;
	}
	public NginxSettings port(int port) {
		if (port < 0 || port > 65535)
			throw new IllegalArgumentException("Port out of range: " + port);
		this.port = port;
		return this;
	}
	/*
	 * Log lines are also sent here, so that the host can show them in its own output panel.
	 */
	private Consumer<String> log = line -> {
	};
	public Consumer<String> log() {
		return log;
	}
	public NginxSettings log(Consumer<String> log) {
		Objects.requireNonNull(log);
		this.log = log;
		return this;
	}
}
