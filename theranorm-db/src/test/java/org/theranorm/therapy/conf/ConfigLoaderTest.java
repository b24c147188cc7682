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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.theranorm.therapy.om.SourceName;

class ConfigLoaderTest {

	@TempDir
	Path tmp;

	private String priorSysProp;

	@AfterEach
	void cleanupSysProp() {
		if (priorSysProp == null) {
			System.clearProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		} else {
			System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, priorSysProp);
		}
	}

	// --- helpers -------------------------------------------------------------

	private Path writePropsFile(Properties p, String filename) throws IOException {
		Path f = tmp.resolve(filename);
		try (var out = Files.newOutputStream(f)) {
			p.store(out, "test");
		}
		return f;
	}

	private Properties minimalRequiredProps() {
		Properties p = new Properties();
		p.setProperty("DATA_PATH", "/data/theranorm");

		// DB essentials
		p.setProperty("DB_DRIVER", "com.mysql.cj.jdbc.Driver");
		p.setProperty("DB_HOST", "localhost");
		p.setProperty("DB_PORT", "3306");
		p.setProperty("DB_USER", "user");
		p.setProperty("DB_PASS", "password");
		p.setProperty("DB_NAME", "theranorm");
		p.setProperty("CHEMBL_DB_NAME", "chembl_33");
		return p;
	}

	// --- tests ---------------------------------------------------------------

	@Test
	void loadsFromFileAndNormalizesDirsAndDefaults() throws Exception {
		Path f = writePropsFile(minimalRequiredProps(), "conf1.properties");

		ConfigLoader loader = new ConfigLoader(f);

		assertEquals("/data/theranorm/", loader.getDataPath());
		assertEquals(Path.of("/data/theranorm/", "rxnorm"), loader.getSourceDataDir(SourceName.RXNORM));
		assertEquals(ConfigLoader.DEFAULT_WRITE_BATCH_SIZE, loader.getWriteBatchSize());
		assertEquals(ConfigLoader.DEFAULT_SCAN_PAGE_SIZE, loader.getScanPageSize());
		assertEquals(SourceName.loadable(), loader.getSources());
		assertEquals("", loader.getDbUrl());
		assertEquals("chembl_33", loader.getChemblDbName());
		assertTrue(loader.validate().isEmpty());
	}

	@Test
	void validateReportsMissingRequired() throws Exception {
		Path f = writePropsFile(new Properties(), "conf_missing.properties");

		List<String> issues = new ConfigLoader(f).validate();

		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: DATA_PATH")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: DB_DRIVER")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: DB_HOST")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: DB_PORT")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: DB_USER")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: DB_PASS")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: DB_NAME")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("CHEMBL_DB_NAME is blank")));
	}

	@Test
	void dbUrlRelaxesHostPortAndName() throws Exception {
		Properties p = minimalRequiredProps();
		p.remove("DB_HOST");
		p.remove("DB_PORT");
		p.remove("DB_NAME");
		p.setProperty("DB_URL", "jdbc:h2:mem:cfg");

		List<String> issues = new ConfigLoader(p).validate();
		assertFalse(issues.stream().anyMatch(s -> s.contains("DB_HOST")));
		assertFalse(issues.stream().anyMatch(s -> s.contains("DB_NAME")));
	}

	@Test
	void sourcesAreParsedAndUnknownNamesReported() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("SOURCES", "rxnorm, DrugBank ,hemonc");
		ConfigLoader loader = new ConfigLoader(p);

		assertEquals(EnumSet.of(SourceName.RXNORM, SourceName.DRUGBANK), loader.getSources());
		assertTrue(loader.validate().stream().anyMatch(s -> s.contains("Unknown source in SOURCES: hemonc")));
	}

	@Test
	void systemPropertyOverrideLoadsExternalFile() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("DATA_PATH", "/elsewhere");
		Path f = writePropsFile(p, "override.properties");

		priorSysProp = System.getProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, f.toAbsolutePath().toString());

		ConfigLoader loader = new ConfigLoader();
		assertEquals("/elsewhere/", loader.getDataPath());
	}

	@Test
	void defaultConstructorReadsClasspathResource() {
		priorSysProp = System.getProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		System.clearProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);

		ConfigLoader loader = new ConfigLoader();
		assertEquals("org.h2.Driver", loader.getDbDriver());
		assertEquals(10, loader.getWriteBatchSize());
	}

	@Test
	void parallelLimitCapsAtCores() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("PARALLEL_SOURCE_LIMIT", "9999");

		int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
		assertEquals(cores, new ConfigLoader(p).getParallelSourceLimit());
	}

	@Test
	void malformedIntegersFallBackToDefaults() {
		Properties p = minimalRequiredProps();
		p.setProperty("WRITE_BATCH_SIZE", "lots");
		p.setProperty("SCAN_PAGE_SIZE", "-4");
		ConfigLoader loader = new ConfigLoader(p);

		assertEquals(ConfigLoader.DEFAULT_WRITE_BATCH_SIZE, loader.getWriteBatchSize());
		assertEquals(ConfigLoader.DEFAULT_SCAN_PAGE_SIZE, loader.getScanPageSize());
	}

	@Test
	void requiredGettersThrowWhenMissing() throws Exception {
		ConfigLoader loader = new ConfigLoader(writePropsFile(new Properties(), "missing_required.properties"));

		assertThrows(IllegalStateException.class, loader::getDataPath);
		assertThrows(IllegalStateException.class, loader::getDbHost);
		assertThrows(IllegalStateException.class, loader::getDbPort);
		assertThrows(IllegalStateException.class, loader::getDbUser);
		assertThrows(IllegalStateException.class, loader::getDbPass);
		assertThrows(IllegalStateException.class, loader::getDbDriver);
		assertThrows(IllegalArgumentException.class, () -> new ConfigLoader(tmp.resolve("nope.properties")));
	}
}
