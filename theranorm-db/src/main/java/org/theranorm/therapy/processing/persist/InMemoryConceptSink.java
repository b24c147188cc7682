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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

import org.theranorm.therapy.om.IdentifierKind;
import org.theranorm.therapy.om.IndexItem;
import org.theranorm.therapy.om.ItemKey;
import org.theranorm.therapy.om.SourceMetadata;
import org.theranorm.therapy.om.SourceName;

/**
 * {@link ConceptSink} held in a sorted map. Same paging and replace semantics
 * as {@link JdbcConceptSink}; items are copied in and out.
 */
public class InMemoryConceptSink implements ConceptSink {

	private final NavigableMap<ItemKey, IndexItem> items = new TreeMap<>();
	private final Map<SourceName, SourceMetadata> metadata = new EnumMap<>(SourceName.class);
	private final int pageSize;

	public InMemoryConceptSink(int pageSize) {
		if (pageSize <= 0) {
			throw new IllegalArgumentException("pageSize must be > 0");
		}
		this.pageSize = pageSize;
	}

	@Override
	public synchronized void put(IndexItem item) throws SinkWriteException {
		items.put(item.key(), item.copy());
	}

	@Override
	public synchronized ScanPage scan(ScanFilter filter, String continuation) {
		NavigableMap<ItemKey, IndexItem> view = continuation == null ? items
				: items.tailMap(ContinuationTokens.decode(continuation), false);
		List<IndexItem> page = new ArrayList<>();
		for (IndexItem item : view.values()) {
			if (!filter.matches(item)) {
				continue;
			}
			if (page.size() == pageSize) {
				return new ScanPage(page, ContinuationTokens.encode(page.get(pageSize - 1).key()));
			}
			page.add(item.copy());
		}
		return new ScanPage(page, null);
	}

	@Override
	public synchronized void update(ItemKey key, ItemUpdate update) throws SinkWriteException {
		IndexItem item = items.get(key);
		if (item == null) {
			throw new SinkWriteException(key, "no item " + key);
		}
		for (Map.Entry<IdentifierKind, List<String>> e : update.getSets().entrySet()) {
			apply(item, e.getKey(), new ArrayList<>(e.getValue()));
		}
		for (IdentifierKind k : update.getRemovals()) {
			apply(item, k, null);
		}
	}

	private static void apply(IndexItem item, IdentifierKind kind, List<String> value) {
		if (kind == IdentifierKind.OTHER_IDENTIFIER) {
			item.setOtherIdentifiers(value);
		} else {
			item.setXrefs(value);
		}
	}

	@Override
	public synchronized Optional<IndexItem> get(ItemKey key) {
		IndexItem item = items.get(key);
		return item == null ? Optional.empty() : Optional.of(item.copy());
	}

	@Override
	public synchronized void putMetadata(SourceMetadata m) throws SinkWriteException {
		metadata.put(m.getSourceName(), m);
	}

	@Override
	public synchronized Optional<SourceMetadata> getMetadata(SourceName source) {
		return Optional.ofNullable(metadata.get(source));
	}

	public synchronized int size() {
		return items.size();
	}
}
