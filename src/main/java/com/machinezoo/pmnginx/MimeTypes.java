// Part of PMNginx
package com.machinezoo.pmnginx;

import java.io.*;
import java.lang.reflect.*;
import java.nio.charset.*;
import java.nio.file.*;
import java.util.*;
import org.apache.commons.io.*;
import com.google.gson.*;
import com.google.gson.reflect.*;
import com.machinezoo.noexception.*;

public class MimeTypes {
	public static final String FALLBACK = "application/octet-stream";
	private static final Map<String, String> byExtension = Exceptions.sneak().get(() -> {
		try (InputStream stream = MimeTypes.class.getResourceAsStream("mime.json")) {
			if (stream == null)
				throw new IllegalStateException("Resource not found: mime.json");
			Type type = new TypeToken<Map<String, String>>() {
			}.getType();
			Map<String, String> parsed = new Gson().fromJson(new InputStreamReader(stream, StandardCharsets.UTF_8), type);
			return Map.copyOf(parsed);
		}
	});
	public static Optional<String> byPath(String path) {
		String extension = FilenameUtils.getExtension(path).toLowerCase(Locale.ROOT);
		return Optional.ofNullable(byExtension.get(extension));
	}
	public static String of(Path path) {
		Path name = path.getFileName();
		if (name == null)
			return FALLBACK;
		return byPath(name.toString()).orElse(FALLBACK);
	}
}
