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

import java.util.Optional;

import org.theranorm.therapy.om.IndexItem;
import org.theranorm.therapy.om.ItemKey;
import org.theranorm.therapy.om.SourceMetadata;
import org.theranorm.therapy.om.SourceName;

/**
 * Durable keyed store of index items and source metadata.
 *
 * <p>Each write is independent and idempotent: {@link #put(IndexItem)} fully
 * replaces the item with the same key. There is no atomicity across items.
 * Reads that cannot be served throw {@link IllegalStateException}.</p>
 */
public interface ConceptSink {

	/** Insert or replace one item. */
	void put(IndexItem item) throws SinkWriteException;

	/**
	 * Next page of items matching {@code filter}, in key order.
	 *
	 * @param continuation token of the previous page, or {@code null} to start
	 */
	ScanPage scan(ScanFilter filter, String continuation);

	/** Apply attribute changes to an existing item. */
	void update(ItemKey key, ItemUpdate update) throws SinkWriteException;

	Optional<IndexItem> get(ItemKey key);

	/** Insert or replace the metadata record of a source. */
	void putMetadata(SourceMetadata metadata) throws SinkWriteException;

	Optional<SourceMetadata> getMetadata(SourceName source);
}
