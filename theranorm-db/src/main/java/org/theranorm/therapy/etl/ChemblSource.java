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

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

import org.apache.commons.lang3.StringUtils;
import org.theranorm.therapy.conf.ConfigLoader;
import org.theranorm.therapy.om.ApprovalStatus;
import org.theranorm.therapy.om.ConceptRecord;
import org.theranorm.therapy.om.NamespacePrefix;
import org.theranorm.therapy.om.SourceMetadata;
import org.theranorm.therapy.om.SourceMetadata.LicenseAttributes;
import org.theranorm.therapy.om.SourceName;
import org.theranorm.therapy.util.Db;
import org.theranorm.therapy.util.Logger;

/**
 * Compound registry. Reads the ChEMBL relational extract and aggregates one
 * concept per {@code molregno}: preferred name as label, synonyms as aliases,
 * product trade names via formulations. ChEMBL records carry no
 * cross-references.
 */
public class ChemblSource implements TherapySource<Connection> {

	static final String SQL_VERSION = "SELECT name FROM version";

	static final String SQL_MOLECULES = "SELECT molregno, chembl_id, pref_name, max_phase, withdrawn_flag "
			+ "FROM molecule_dictionary ORDER BY molregno";

	static final String SQL_SYNONYMS = "SELECT molregno, synonyms FROM molecule_synonyms ORDER BY molregno, molsyn_id";

	static final String SQL_TRADE_NAMES = "SELECT f.molregno, p.trade_name FROM formulations f "
			+ "LEFT JOIN products p ON f.product_id = p.product_id ORDER BY f.molregno, f.product_id";

	private static final BigDecimal PHASE_APPROVED = BigDecimal.valueOf(4);

	private final Callable<Connection> connector;
	private String version;

	/**
	 * @param connector opens a connection to the extract; the caller of
	 *                  {@link #extract()} owns and closes it
	 */
	public ChemblSource(Callable<Connection> connector) {
		this.connector = Objects.requireNonNull(connector, "connector");
	}

	/** Source over the {@code CHEMBL_DB_NAME} schema of the configured server. */
	public static ChemblSource fromConfig(ConfigLoader cfg) {
		return new ChemblSource(() -> {
			String schema = cfg.getChemblDbName();
			if (StringUtils.isBlank(schema)) {
				throw new IllegalStateException("CHEMBL_DB_NAME is not configured");
			}
			return Db.open(cfg, schema);
		});
	}

	@Override
	public SourceName getSourceName() {
		return SourceName.CHEMBL;
	}

	@Override
	public Connection extract() throws SourceUnavailableException {
		Logger.info("ChEMBL: opening relational extract");
		Connection conn;
		try {
			conn = connector.call();
		} catch (Exception e) {
			throw new SourceUnavailableException(SourceName.CHEMBL, "cannot connect to extract: " + e.getMessage(), e);
		}
		try {
			List<String> names = Db.runQuery(conn, SQL_VERSION, null, rs -> rs.getString(1));
			version = names.isEmpty() ? null : StringUtils.removeStartIgnoreCase(names.get(0), "ChEMBL_");
			Logger.info("ChEMBL: extract version {}", version);
			return conn;
		} catch (SQLException e) {
			closeQuietly(conn, e);
			throw new SourceUnavailableException(SourceName.CHEMBL, "extract has no readable version table", e);
		}
	}

	@Override
	public TransformResult transform(Connection conn) {
		Map<Long, ConceptRecord.Builder> byMolregno = new LinkedHashMap<>();
		int[] skipped = { 0 };

		try {
			Db.streamQuery(conn, SQL_MOLECULES, null, rs -> {
				while (rs.next()) {
					long molregno = rs.getLong("molregno");
					String chemblId = rs.getString("chembl_id");
					if (StringUtils.isBlank(chemblId)) {
						Logger.warn("ChEMBL: molregno {} has no chembl_id; skipped", molregno);
						skipped[0]++;
						continue;
					}
					BigDecimal maxPhase = rs.getBigDecimal("max_phase");
					int withdrawn = rs.getInt("withdrawn_flag");
					boolean isWithdrawn = !rs.wasNull() && withdrawn != 0;

					ConceptRecord.Builder b = ConceptRecord.builder(NamespacePrefix.CHEMBL.curie(chemblId),
							SourceName.CHEMBL);
					b.label(rs.getString("pref_name"));
					b.approvalStatus(approvalStatus(isWithdrawn, maxPhase));
					byMolregno.put(molregno, b);
				}
			});

			Db.streamQuery(conn, SQL_SYNONYMS, null, rs -> {
				while (rs.next()) {
					long molregno = rs.getLong("molregno");
					ConceptRecord.Builder b = byMolregno.get(molregno);
					if (b == null) {
						Logger.warn("ChEMBL: synonym for unknown molregno {}; skipped", molregno);
						skipped[0]++;
						continue;
					}
					b.alias(rs.getString("synonyms"));
				}
			});

			Db.streamQuery(conn, SQL_TRADE_NAMES, null, rs -> {
				while (rs.next()) {
					long molregno = rs.getLong("molregno");
					ConceptRecord.Builder b = byMolregno.get(molregno);
					if (b == null) {
						Logger.warn("ChEMBL: formulation for unknown molregno {}; skipped", molregno);
						skipped[0]++;
						continue;
					}
					b.tradeName(rs.getString("trade_name"));
				}
			});
		} catch (SQLException e) {
			// the extract is read in full or not at all
			throw new IllegalStateException("ChEMBL extract read failed: " + e.getMessage(), e);
		}

		List<ConceptRecord> out = new ArrayList<>(byMolregno.size());
		byMolregno.values().forEach(b -> out.add(b.build()));
		Logger.info("ChEMBL: {} concepts, {} skipped rows", out.size(), skipped[0]);
		return TransformResult.of(out, skipped[0]);
	}

	/**
	 * withdrawn flag, then phase 4 approved, phase 0 no status, anything else
	 * (a missing phase included) investigational.
	 */
	static ApprovalStatus approvalStatus(boolean withdrawn, BigDecimal maxPhase) {
		if (withdrawn) {
			return ApprovalStatus.WITHDRAWN;
		}
		if (maxPhase != null && maxPhase.compareTo(PHASE_APPROVED) == 0) {
			return ApprovalStatus.APPROVED;
		}
		if (maxPhase != null && maxPhase.signum() == 0) {
			return null;
		}
		return ApprovalStatus.INVESTIGATIONAL;
	}

	@Override
	public SourceMetadata metadata() {
		return new SourceMetadata(SourceName.CHEMBL, "CC BY-SA 3.0",
				"https://creativecommons.org/licenses/by-sa/3.0/", version, "https://www.ebi.ac.uk/chembl/",
				"http://reusabledata.org/chembl.html", new LicenseAttributes(false, true, true));
	}

	private static void closeQuietly(Connection conn, Exception primary) {
		try {
			conn.close();
		} catch (SQLException e) {
			primary.addSuppressed(e);
		}
	}
}
