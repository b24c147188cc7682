package org.theranorm.therapy.processing.persist;

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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.theranorm.therapy.conf.ConfigLoader;
import org.theranorm.therapy.om.IdentifierKind;
import org.theranorm.therapy.om.IndexItem;
import org.theranorm.therapy.om.ItemKey;
import org.theranorm.therapy.om.ItemType;
import org.theranorm.therapy.om.SourceMetadata;
import org.theranorm.therapy.om.SourceMetadata.LicenseAttributes;
import org.theranorm.therapy.om.SourceName;
import org.theranorm.therapy.util.Db;

/**
 * {@link ConceptSink} over two tables of a relational database.
 *
 * <ul>
 * <li>{@code therapy_concepts}, keyed by ({@code label_and_type},
 * {@code concept_id}); list attributes in one text column each (see
 * {@link ListColumns}).</li>
 * <li>{@code therapy_metadata}, one row per source.</li>
 * </ul>
 *
 * Every write is a delete-then-insert (or update) in its own transaction.
 * Calls are serialized on the single connection, which the caller owns.
 */
public class JdbcConceptSink implements ConceptSink {

	static final String T_CONCEPTS = "therapy_concepts";
	static final String T_METADATA = "therapy_metadata";

	private static final String DDL_CONCEPTS = "CREATE TABLE IF NOT EXISTS " + T_CONCEPTS + " ("
			+ " label_and_type VARCHAR(512) NOT NULL,"
			+ " concept_id VARCHAR(128) NOT NULL,"
			+ " item_type VARCHAR(16) NOT NULL,"
			+ " src_name VARCHAR(32) NOT NULL,"
			+ " label TEXT,"
			+ " aliases TEXT,"
			+ " trade_names TEXT,"
			+ " other_identifiers TEXT,"
			+ " xrefs TEXT,"
			+ " approval_status VARCHAR(32),"
			+ " approval_ratings TEXT,"
			+ " PRIMARY KEY (label_and_type, concept_id)"
			+ ")";

	private static final String DDL_METADATA = "CREATE TABLE IF NOT EXISTS " + T_METADATA + " ("
			+ " src_name VARCHAR(32) NOT NULL PRIMARY KEY,"
			+ " data_license VARCHAR(128),"
			+ " data_license_url VARCHAR(512),"
			+ " version VARCHAR(64),"
			+ " data_url VARCHAR(512),"
			+ " rdp_url VARCHAR(512),"
			+ " non_commercial BOOLEAN,"
			+ " share_alike BOOLEAN,"
			+ " attribution BOOLEAN"
			+ ")";

	private static final String COLUMNS = "label_and_type, concept_id, item_type, src_name, label, aliases, "
			+ "trade_names, other_identifiers, xrefs, approval_status, approval_ratings";

	private static final String SQL_DELETE = "DELETE FROM " + T_CONCEPTS + " WHERE label_and_type = ? AND concept_id = ?";
	private static final String SQL_INSERT = "INSERT INTO " + T_CONCEPTS + " (" + COLUMNS
			+ ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
	private static final String SQL_GET = "SELECT " + COLUMNS + " FROM " + T_CONCEPTS
			+ " WHERE label_and_type = ? AND concept_id = ?";

	private static final String SQL_DELETE_META = "DELETE FROM " + T_METADATA + " WHERE src_name = ?";
	private static final String SQL_INSERT_META = "INSERT INTO " + T_METADATA
			+ " (src_name, data_license, data_license_url, version, data_url, rdp_url, non_commercial, share_alike, attribution)"
			+ " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
	private static final String SQL_GET_META = "SELECT * FROM " + T_METADATA + " WHERE src_name = ?";

	private final Connection conn;
	private final int pageSize;

	public JdbcConceptSink(Connection conn, int pageSize) {
		this.conn = Objects.requireNonNull(conn, "conn");
		if (pageSize <= 0) {
			throw new IllegalArgumentException("pageSize must be > 0");
		}
		this.pageSize = pageSize;
	}

	/** Sink over {@code conn} paged by {@code SCAN_PAGE_SIZE}. */
	public static JdbcConceptSink forConfig(Connection conn, ConfigLoader cfg) {
		return new JdbcConceptSink(conn, cfg.getScanPageSize());
	}

	/** Create both tables when missing. */
	public synchronized void createTables() throws SQLException {
		Db.execute(conn, DDL_CONCEPTS, null);
		Db.execute(conn, DDL_METADATA, null);
	}

	@Override
	public synchronized void put(IndexItem item) throws SinkWriteException {
		ItemKey key = item.key();
		try {
			Db.withTransaction(conn, () -> {
				Db.execute(conn, SQL_DELETE, ps -> bindKey(ps, key));
				Db.execute(conn, SQL_INSERT, ps -> bindItem(ps, item));
			});
		} catch (SQLException e) {
			throw new SinkWriteException(key, "put failed: " + e.getMessage(), e);
		}
	}

	@Override
	public synchronized ScanPage scan(ScanFilter filter, String continuation) {
		StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM ").append(T_CONCEPTS)
				.append(" WHERE 1 = 1");
		List<String> params = new ArrayList<>();
		if (filter.itemType() != null) {
			sql.append(" AND item_type = ?");
			params.add(filter.itemType().getTag());
		}
		if (filter.excludedSrcName() != null) {
			sql.append(" AND src_name <> ?");
			params.add(filter.excludedSrcName());
		}
		if (continuation != null) {
			ItemKey after = ContinuationTokens.decode(continuation);
			sql.append(" AND (label_and_type > ? OR (label_and_type = ? AND concept_id > ?))");
			params.add(after.labelAndType());
			params.add(after.labelAndType());
			params.add(after.conceptId());
		}
		// one extra row tells whether another page exists
		sql.append(" ORDER BY label_and_type, concept_id LIMIT ").append(pageSize + 1);

		try {
			List<IndexItem> rows = Db.runQuery(conn, sql.toString(), ps -> {
				for (int i = 0; i < params.size(); i++) {
					ps.setString(i + 1, params.get(i));
				}
			}, JdbcConceptSink::mapItem);
			if (rows.size() <= pageSize) {
				return new ScanPage(rows, null);
			}
			List<IndexItem> page = rows.subList(0, pageSize);
			return new ScanPage(page, ContinuationTokens.encode(page.get(pageSize - 1).key()));
		} catch (SQLException e) {
			throw new IllegalStateException("scan failed: " + e.getMessage(), e);
		}
	}

	@Override
	public synchronized void update(ItemKey key, ItemUpdate update) throws SinkWriteException {
		if (update.isEmpty()) {
			return;
		}
		List<String> assignments = new ArrayList<>();
		List<String> values = new ArrayList<>();
		for (Map.Entry<IdentifierKind, List<String>> e : update.getSets().entrySet()) {
			assignments.add(e.getKey().getAttribute() + " = ?");
			values.add(ListColumns.encode(e.getValue()));
		}
		for (IdentifierKind k : update.getRemovals()) {
			assignments.add(k.getAttribute() + " = ?");
			values.add(null);
		}
		String sql = "UPDATE " + T_CONCEPTS + " SET " + String.join(", ", assignments)
				+ " WHERE label_and_type = ? AND concept_id = ?";
		int[] updated = { 0 };
		try {
			Db.withTransaction(conn, () -> updated[0] = Db.execute(conn, sql, ps -> {
				int i = 1;
				for (String v : values) {
					if (v == null) {
						ps.setNull(i++, Types.VARCHAR);
					} else {
						ps.setString(i++, v);
					}
				}
				ps.setString(i++, key.labelAndType());
				ps.setString(i, key.conceptId());
			}));
		} catch (SQLException e) {
			throw new SinkWriteException(key, "update failed: " + e.getMessage(), e);
		}
		if (updated[0] == 0) {
			throw new SinkWriteException(key, "no item " + key);
		}
	}

	@Override
	public synchronized Optional<IndexItem> get(ItemKey key) {
		try {
			List<IndexItem> rows = Db.runQuery(conn, SQL_GET, ps -> bindKey(ps, key), JdbcConceptSink::mapItem);
			return rows.stream().findFirst();
		} catch (SQLException e) {
			throw new IllegalStateException("get failed: " + e.getMessage(), e);
		}
	}

	@Override
	public synchronized void putMetadata(SourceMetadata m) throws SinkWriteException {
		LicenseAttributes la = m.getLicenseAttributes() == null ? new LicenseAttributes() : m.getLicenseAttributes();
		try {
			Db.withTransaction(conn, () -> {
				Db.execute(conn, SQL_DELETE_META, ps -> ps.setString(1, m.getSourceName().getDisplayName()));
				Db.execute(conn, SQL_INSERT_META, ps -> {
					ps.setString(1, m.getSourceName().getDisplayName());
					ps.setString(2, m.getDataLicense());
					ps.setString(3, m.getDataLicenseUrl());
					ps.setString(4, m.getVersion());
					ps.setString(5, m.getDataUrl());
					ps.setString(6, m.getRdpUrl());
					ps.setBoolean(7, la.isNonCommercial());
					ps.setBoolean(8, la.isShareAlike());
					ps.setBoolean(9, la.isAttribution());
				});
			});
		} catch (SQLException e) {
			throw new SinkWriteException(null, "metadata write for " + m.getSourceName() + " failed: " + e.getMessage(), e);
		}
	}

	@Override
	public synchronized Optional<SourceMetadata> getMetadata(SourceName source) {
		try {
			List<SourceMetadata> rows = Db.runQuery(conn, SQL_GET_META, ps -> ps.setString(1, source.getDisplayName()),
					rs -> new SourceMetadata(source, rs.getString("data_license"), rs.getString("data_license_url"),
							rs.getString("version"), rs.getString("data_url"), rs.getString("rdp_url"),
							new LicenseAttributes(rs.getBoolean("non_commercial"), rs.getBoolean("share_alike"),
									rs.getBoolean("attribution"))));
			return rows.stream().findFirst();
		} catch (SQLException e) {
			throw new IllegalStateException("metadata read failed: " + e.getMessage(), e);
		}
	}

	// -------------------------- Row mapping ------------------------------------

	private static void bindKey(PreparedStatement ps, ItemKey key) throws SQLException {
		ps.setString(1, key.labelAndType());
		ps.setString(2, key.conceptId());
	}

	private static void bindItem(PreparedStatement ps, IndexItem item) throws SQLException {
		ps.setString(1, item.getLabelAndType());
		ps.setString(2, item.getConceptId());
		ps.setString(3, item.getItemType().getTag());
		ps.setString(4, item.getSrcName());
		ps.setString(5, item.getLabel());
		ps.setString(6, ListColumns.encode(item.getAliases()));
		ps.setString(7, ListColumns.encode(item.getTradeNames()));
		ps.setString(8, ListColumns.encode(item.getOtherIdentifiers()));
		ps.setString(9, ListColumns.encode(item.getXrefs()));
		ps.setString(10, item.getApprovalStatus());
		ps.setString(11, ListColumns.encode(item.getApprovalRatings()));
	}

	private static IndexItem mapItem(ResultSet rs) throws SQLException {
		IndexItem item = new IndexItem();
		item.setLabelAndType(rs.getString("label_and_type"));
		item.setConceptId(rs.getString("concept_id"));
		item.setItemType(ItemType.fromTag(rs.getString("item_type")));
		item.setSrcName(rs.getString("src_name"));
		item.setLabel(rs.getString("label"));
		item.setAliases(ListColumns.decode(rs.getString("aliases")));
		item.setTradeNames(ListColumns.decode(rs.getString("trade_names")));
		item.setOtherIdentifiers(ListColumns.decode(rs.getString("other_identifiers")));
		item.setXrefs(ListColumns.decode(rs.getString("xrefs")));
		item.setApprovalStatus(rs.getString("approval_status"));
		item.setApprovalRatings(ListColumns.decode(rs.getString("approval_ratings")));
		return item;
	}
}
