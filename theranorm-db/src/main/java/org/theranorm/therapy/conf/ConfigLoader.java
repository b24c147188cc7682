package org.theranorm.therapy.conf;

/*
 * This file is part of TheraNorm.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * TheraNorm is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * TheraNorm is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with TheraNorm.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.theranorm.therapy.om.SourceName;
import org.theranorm.therapy.util.Logger;

/**
 * Loads loader configuration from a {@code .properties} file.
 * <p>
 * By default, this loader reads <code>config/theranorm.properties</code> from
 * the classpath. You can override this by setting the system property
 * <code>theranorm.config</code> to a path on disk, or by using the
 * {@link #ConfigLoader(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>Directory-like values are normalized to end with a trailing slash.</li>
 * <li>{@code DB_URL}, when present, overrides host/port/name for the index
 * database (handy for H2 or a non-MySQL server).</li>
 * <li>Use {@link #validate()} during startup to check for missing required
 * keys.</li>
 * </ul>
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/theranorm.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "theranorm.config";

	// ---- Property keys --------------------------------------------------------
	private static final String K_DATA_PATH = "DATA_PATH";
	private static final String K_SOURCES = "SOURCES";

	private static final String K_DB_DRIVER = "DB_DRIVER";
	private static final String K_DB_HOST = "DB_HOST";
	private static final String K_DB_PORT = "DB_PORT";
	private static final String K_DB_USER = "DB_USER";
	private static final String K_DB_PASS = "DB_PASS";
	private static final String K_DB_NAME = "DB_NAME";
	private static final String K_DB_URL = "DB_URL";
	private static final String K_CHEMBL_DB_NAME = "CHEMBL_DB_NAME";

	private static final String K_WRITE_BATCH_SIZE = "WRITE_BATCH_SIZE";
	private static final String K_SCAN_PAGE_SIZE = "SCAN_PAGE_SIZE";
	private static final String K_PARALLEL_SOURCE_LIMIT = "PARALLEL_SOURCE_LIMIT";

	static final int DEFAULT_WRITE_BATCH_SIZE = 25;
	static final int DEFAULT_SCAN_PAGE_SIZE = 100;

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Create a loader that reads the default classpath resource
	 * {@value #DEFAULT_CLASSPATH_RESOURCE}, unless {@value #SYS_PROP_CONFIG_PATH}
	 * points to a readable file.
	 */
	public ConfigLoader() {
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (StringUtils.isNotBlank(external)) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			}
			Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
		}
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Create a loader that reads a specific file on disk.
	 *
	 * @param filePath absolute or relative path to a .properties file
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public ConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	/** Loader over in-memory properties (tests, embedding callers). */
	public ConfigLoader(Properties props) {
		if (props != null) {
			properties.putAll(props);
		}
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Reports missing required keys and suspicious values. Never throws; the
	 * caller decides whether to fail fast.
	 *
	 * @return list of issues; empty if the configuration looks usable
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();

		requireNonBlank(K_DATA_PATH, issues);

		requireNonBlank(K_DB_DRIVER, issues);
		requireNonBlank(K_DB_USER, issues);
		requireNonBlank(K_DB_PASS, issues);
		if (StringUtils.isBlank(properties.getProperty(K_DB_URL))) {
			requireNonBlank(K_DB_HOST, issues);
			requireNonBlank(K_DB_PORT, issues);
			requireNonBlank(K_DB_NAME, issues);
		}

		String sources = getOptional(K_SOURCES, null);
		if (sources != null) {
			for (String s : sources.split(",")) {
				if (!s.isBlank() && SourceName.fromName(s.trim()) == null) {
					issues.add("Unknown source in " + K_SOURCES + ": " + s.trim());
				}
			}
		}
		if (getSources().contains(SourceName.CHEMBL) && getChemblDbName().isEmpty()) {
			issues.add("Warning: " + K_CHEMBL_DB_NAME + " is blank; the ChEMBL load will report the source as unavailable.");
		}
		return issues;
	}

	/** Root directory holding one sub-directory per source. */
	public String getDataPath() {
		return normalizedDir(getRequired(K_DATA_PATH));
	}

	/** Data directory of one source, e.g. {@code <DATA_PATH>/rxnorm/}. */
	public Path getSourceDataDir(SourceName source) {
		return Path.of(getDataPath(), source.name().toLowerCase(Locale.ROOT));
	}

	/** Sources to load; all adapters with a loader when {@code SOURCES} is unset. */
	public Set<SourceName> getSources() {
		Set<SourceName> out = EnumSet.noneOf(SourceName.class);
		String raw = getOptional(K_SOURCES, null);
		if (raw == null) {
			out.addAll(SourceName.loadable());
			return out;
		}
		for (String s : raw.split(",")) {
			SourceName src = SourceName.fromName(s.trim());
			if (src != null) {
				out.add(src);
			}
		}
		return out;
	}

	/** JDBC driver class name. */
	public String getDbDriver() {
		return getRequired(K_DB_DRIVER);
	}

	/** Hostname for the index database server. */
	public String getDbHost() {
		return getRequired(K_DB_HOST);
	}

	public String getDbPort() {
		return getRequired(K_DB_PORT);
	}

	public String getDbUser() {
		return getRequired(K_DB_USER);
	}

	public String getDbPass() {
		return getRequired(K_DB_PASS);
	}

	/** Database/schema holding the concept index. */
	public String getDbName() {
		return getOptional(K_DB_NAME, "");
	}

	/** Optional full JDBC URL for the index database. */
	public String getDbUrl() {
		return getOptional(K_DB_URL, "");
	}

	/** Optional: schema with the ChEMBL relational extract on the same server. */
	public String getChemblDbName() {
		return getOptional(K_CHEMBL_DB_NAME, "");
	}

	/** Items buffered by the index writer before a flush. */
	public int getWriteBatchSize() {
		return positiveInt(K_WRITE_BATCH_SIZE, DEFAULT_WRITE_BATCH_SIZE);
	}

	/** Identity records fetched per backfill scan page. */
	public int getScanPageSize() {
		return positiveInt(K_SCAN_PAGE_SIZE, DEFAULT_SCAN_PAGE_SIZE);
	}

	/**
	 * Number of sources loaded concurrently. Defaults to ~25% of available
	 * cores and never exceeds the core count.
	 */
	public int getParallelSourceLimit() {
		int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
		int defaultLimit = Math.max(1, (int) Math.floor(cores / 4.0));
		return Math.min(positiveInt(K_PARALLEL_SOURCE_LIMIT, defaultLimit), cores);
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(in);
		} catch (IOException ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = new FileInputStream(file.toFile())) {
			properties.load(in);
		} catch (IOException ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
		}
	}

	private int positiveInt(String key, int defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null) {
			return defaultVal;
		}
		try {
			int val = Integer.parseInt(raw);
			return val > 0 ? val : defaultVal;
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid integer for {}: '{}'. Using default {}", key, raw, defaultVal);
			return defaultVal;
		}
	}

	private String getRequired(String key) {
		String v = getOptional(key, null);
		if (v == null) {
			throw new IllegalStateException("Missing required property: " + key);
		}
		return v;
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null) {
			return defaultVal;
		}
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private static String normalizedDir(String path) {
		String p = path.trim();
		return p.endsWith("/") ? p : p + "/";
	}

	private void requireNonBlank(String key, List<String> issues) {
		if (StringUtils.isBlank(properties.getProperty(key))) {
			issues.add("Missing required property: " + key);
		}
	}
}
