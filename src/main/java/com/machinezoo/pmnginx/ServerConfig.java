// Part of PMNginx
package com.machinezoo.pmnginx;

import java.nio.file.*;
import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Built once per server start by ServerConfigs and never modified afterwards.
 * Restart builds a new instance.
 */
/**
 * Flat, typed view of the first {@code server} block.
 */
@StubDocs
public class ServerConfig {
	public static final int DEFAULT_PORT = 80;
	public static final List<String> DEFAULT_INDEX = List.of("index.html", "index.htm");
	private final int listenPort;
	public int listenPort() {
		return listenPort;
	}
	private final Path documentRoot;
	public Path documentRoot() {
		return documentRoot;
	}
	/*
	 * Location roots are resolved against this directory.
	 */
	private final Path baseDirectory;
	public Path baseDirectory() {
		return baseDirectory;
	}
	private final List<String> indexFiles;
	public List<String> indexFiles() {
		return indexFiles;
	}
	/*
	 * Source order matters for prefix ties and for regex scanning.
	 */
	private final List<LocationRule> locations;
	public List<LocationRule> locations() {
		return locations;
	}
	public ServerConfig(int listenPort, Path documentRoot, Path baseDirectory, List<String> indexFiles, List<LocationRule> locations) {
		if (listenPort < 1 || listenPort > 65535)
			throw new IllegalArgumentException("Port out of range: " + listenPort);
		if (!documentRoot.isAbsolute() || !baseDirectory.isAbsolute())
			throw new IllegalArgumentException("Document root and base directory must be absolute.");
		if (indexFiles.isEmpty())
			throw new IllegalArgumentException("At least one index file is required.");
		this.listenPort = listenPort;
		this.documentRoot = documentRoot;
		this.baseDirectory = baseDirectory;
		this.indexFiles = List.copyOf(indexFiles);
		for (var location : locations)
			location.freeze();
		this.locations = List.copyOf(locations);
	}
}
