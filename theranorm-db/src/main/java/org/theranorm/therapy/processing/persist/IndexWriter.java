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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.theranorm.therapy.om.ConceptRecord;
import org.theranorm.therapy.om.IndexItem;
import org.theranorm.therapy.om.LookupRecord;
import org.theranorm.therapy.om.LookupRecords;
import org.theranorm.therapy.om.TermSets;
import org.theranorm.therapy.util.Logger;

/**
 * Buffered writer of concept records into a {@link ConceptSink}.
 *
 * <p>A record is written as its identity item followed by its lookup items,
 * in that order. Buffers are flushed every {@code batchSize} items and on
 * {@link #close()}. Failures are collected per item in the {@link WriteReport};
 * when an identity item fails, the lookups of that concept are not written.</p>
 */
public class IndexWriter implements AutoCloseable {

	private final ConceptSink sink;
	private final int batchSize;

	private final List<IndexItem> buffer = new ArrayList<>();
	private final Set<String> failedConcepts = new HashSet<>();
	private final WriteReport report = new WriteReport();
	private boolean closed;

	public IndexWriter(ConceptSink sink, int batchSize) {
		this.sink = Objects.requireNonNull(sink, "sink");
		if (batchSize <= 0) {
			throw new IllegalArgumentException("batchSize must be > 0");
		}
		this.batchSize = batchSize;
	}

	/** Queue a record's identity item and the lookups derived from it. */
	public void add(ConceptRecord record) {
		ensureOpen();
		buffer.add(identityItem(record));
		for (LookupRecord l : LookupRecords.derive(record)) {
			buffer.add(IndexItem.fromLookup(l));
		}
		flushIfFull();
	}

	/** Queue a lookup that is not derived from a record, e.g. a brand association. */
	public void addLookup(LookupRecord lookup) {
		ensureOpen();
		buffer.add(IndexItem.fromLookup(lookup));
		flushIfFull();
	}

	private void flushIfFull() {
		if (buffer.size() >= batchSize) {
			flush();
		}
	}

	public void flush() {
		int n = buffer.size();
		for (IndexItem item : buffer) {
			String owner = TermSets.lower(item.getConceptId());
			if (!item.isIdentity() && failedConcepts.contains(owner)) {
				report.skipped(1);
				continue;
			}
			try {
				sink.put(item);
				report.written();
			} catch (SinkWriteException e) {
				report.failed(item.key(), e.getMessage());
				Logger.warn("Write failed for {} / {}: {}", item.getLabelAndType(), item.getConceptId(), e.getMessage());
				if (item.isIdentity()) {
					failedConcepts.add(owner);
				}
			}
		}
		buffer.clear();
		Logger.debug("Flushed {} items", n);
	}

	/** Flush what is left; further adds are rejected. */
	@Override
	public void close() {
		if (!closed) {
			flush();
			closed = true;
		}
	}

	public WriteReport getReport() {
		return report;
	}

	/** Identity item with the fan-out cap and folded de-duplication applied once more. */
	static IndexItem identityItem(ConceptRecord record) {
		IndexItem item = IndexItem.fromConcept(record);
		item.setAliases(capped(item.getAliases()));
		item.setTradeNames(capped(item.getTradeNames()));
		return item;
	}

	private static List<String> capped(List<String> values) {
		if (values == null) {
			return null;
		}
		Set<String> kept = TermSets.capped(values);
		return kept.isEmpty() ? null : new ArrayList<>(kept);
	}

	private void ensureOpen() {
		if (closed) {
			throw new IllegalStateException("writer closed");
		}
	}
}
