package org.theranorm.therapy.etl;

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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.theranorm.therapy.om.ApprovalStatus;
import org.theranorm.therapy.om.ConceptRecord;
import org.theranorm.therapy.om.SourceMetadata;
import org.theranorm.therapy.util.Db;

class ChemblSourceTest {

	private static final String URL = "jdbc:h2:mem:chembl_extract;MODE=MySQL;DATABASE_TO_UPPER=false;DB_CLOSE_DELAY=-1";

	private Connection conn;

	@BeforeEach
	void setUp() throws Exception {
		conn = connect();
		Db.execute(conn, "DROP ALL OBJECTS", null);
		Db.execute(conn, "CREATE TABLE version (name VARCHAR(32))", null);
		Db.execute(conn, "CREATE TABLE molecule_dictionary (molregno BIGINT PRIMARY KEY, chembl_id VARCHAR(20), "
				+ "pref_name VARCHAR(255), max_phase DECIMAL(2,1), withdrawn_flag SMALLINT)", null);
		Db.execute(conn, "CREATE TABLE molecule_synonyms (molsyn_id INT PRIMARY KEY, molregno BIGINT, "
				+ "synonyms VARCHAR(255))", null);
		Db.execute(conn, "CREATE TABLE products (product_id VARCHAR(30) PRIMARY KEY, trade_name VARCHAR(200))", null);
		Db.execute(conn, "CREATE TABLE formulations (record_id INT PRIMARY KEY, product_id VARCHAR(30), "
				+ "molregno BIGINT)", null);

		Db.execute(conn, "INSERT INTO version VALUES ('ChEMBL_33')", null);
		Db.execute(conn, "INSERT INTO molecule_dictionary VALUES "
				+ "(1280, 'CHEMBL25', 'ASPIRIN', 4, 0), "
				+ "(675, 'CHEMBL112', 'ACETAMINOPHEN', 4, 1), "
				+ "(9001, 'CHEMBL9001', NULL, 2, 0), "
				+ "(9002, 'CHEMBL9002', 'PHASE ZERO', 0, NULL), "
				+ "(9003, 'CHEMBL9003', 'NO PHASE', NULL, 0)", null);
		Db.execute(conn, "INSERT INTO molecule_synonyms VALUES "
				+ "(1, 1280, 'Acetylsalicylic acid'), (2, 1280, 'ACETYLSALICYLIC ACID'), (3, 1280, 'Aspirin'), "
				+ "(4, 4242, 'Orphan synonym')", null);
		Db.execute(conn, "INSERT INTO products VALUES ('P1', 'BAYER ASPIRIN'), ('P2', 'ECOTRIN')", null);
		Db.execute(conn, "INSERT INTO formulations VALUES (1, 'P1', 1280), (2, 'P2', 1280), (3, 'P9', 1280)", null);
	}

	@AfterEach
	void tearDown() throws SQLException {
		if (conn != null) conn.close();
	}

	private static Connection connect() throws SQLException {
		return Db.getConnection(URL, "sa", "", "org.h2.Driver", 0, Duration.ofMillis(1));
	}

	@Test
	void aggregatesOneConceptPerMolecule() throws Exception {
		ChemblSource src = new ChemblSource(ChemblSourceTest::connect);
		TransformResult result;
		try (Connection extract = src.extract()) {
			result = src.transform(extract);
		}

		Map<String, ConceptRecord> byId = result.concepts().stream()
				.collect(Collectors.toMap(ConceptRecord::getConceptId, Function.identity()));
		assertEquals(5, byId.size());
		assertEquals(1, result.skipped(), "orphan synonym");

		ConceptRecord aspirin = byId.get("chembl:CHEMBL25");
		assertEquals("ASPIRIN", aspirin.getLabel().get());
		assertEquals(Set.of("Acetylsalicylic acid", "Aspirin"), aspirin.getAliases());
		assertEquals(Set.of("BAYER ASPIRIN", "ECOTRIN"), aspirin.getTradeNames());
		assertEquals(ApprovalStatus.APPROVED, aspirin.getApprovalStatus().get());
		assertTrue(aspirin.getOtherIdentifiers().isEmpty());
		assertTrue(aspirin.getXrefs().isEmpty());

		assertEquals(ApprovalStatus.WITHDRAWN, byId.get("chembl:CHEMBL112").getApprovalStatus().get());
		assertFalse(byId.get("chembl:CHEMBL9001").getLabel().isPresent());
		assertEquals(ApprovalStatus.INVESTIGATIONAL, byId.get("chembl:CHEMBL9001").getApprovalStatus().get());
		assertFalse(byId.get("chembl:CHEMBL9002").getApprovalStatus().isPresent());
		assertEquals(ApprovalStatus.INVESTIGATIONAL, byId.get("chembl:CHEMBL9003").getApprovalStatus().get());
	}

	@Test
	void versionAndMetadata() throws Exception {
		ChemblSource src = new ChemblSource(ChemblSourceTest::connect);
		try (Connection extract = src.extract()) {
			SourceMetadata md = src.metadata();
			assertEquals("33", md.getVersion());
			assertEquals("CC BY-SA 3.0", md.getDataLicense());
			assertTrue(md.getLicenseAttributes().isShareAlike());
			assertFalse(md.getLicenseAttributes().isNonCommercial());
		}
	}

	@Test
	void unreachableExtractIsUnavailable() {
		ChemblSource src = new ChemblSource(() -> {
			throw new SQLException("connection refused");
		});
		assertThrows(SourceUnavailableException.class, src::extract);
	}

	@Test
	void extractWithoutVersionTableIsUnavailable() throws Exception {
		Db.execute(conn, "DROP TABLE version", null);
		ChemblSource src = new ChemblSource(ChemblSourceTest::connect);
		assertThrows(SourceUnavailableException.class, src::extract);
	}

	@Test
	void approvalStatusRules() {
		assertEquals(ApprovalStatus.WITHDRAWN, ChemblSource.approvalStatus(true, BigDecimal.valueOf(4)));
		assertEquals(ApprovalStatus.APPROVED, ChemblSource.approvalStatus(false, new BigDecimal("4.0")));
		assertEquals(ApprovalStatus.INVESTIGATIONAL, ChemblSource.approvalStatus(false, new BigDecimal("0.5")));
		assertEquals(ApprovalStatus.INVESTIGATIONAL, ChemblSource.approvalStatus(false, null));
		assertEquals(ApprovalStatus.WITHDRAWN, ChemblSource.approvalStatus(true, null));
		assertNull(ChemblSource.approvalStatus(false, BigDecimal.ZERO));
	}
}
