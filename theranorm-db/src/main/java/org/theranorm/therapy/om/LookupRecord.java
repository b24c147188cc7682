package org.theranorm.therapy.om;

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

import java.util.Objects;

/**
 * Minimal record that resolves one searchable string to the concept that
 * owns it. Key and concept id are stored lowercased.
 *
 * @param key         {@code <lowercased lookup string>##<type tag>}
 * @param conceptId   lowercased id of the concept the key resolves to
 * @param sourceName  source that produced the owning concept
 * @param itemType    lookup subtype
 */
public record LookupRecord(String key, String conceptId, SourceName sourceName, ItemType itemType) {

	public LookupRecord {
		Objects.requireNonNull(key, "key");
		Objects.requireNonNull(conceptId, "conceptId");
		Objects.requireNonNull(sourceName, "sourceName");
		Objects.requireNonNull(itemType, "itemType");
		if (itemType == ItemType.IDENTITY) {
			throw new IllegalArgumentException("identity items are not lookups");
		}
	}

	/** Lookup of {@code value} (label, alias or trade name) for a concept. */
	public static LookupRecord of(ItemType type, String value, String conceptId, SourceName source) {
		return new LookupRecord(type.key(value), TermSets.lower(conceptId), source, type);
	}

	/**
	 * Brand association: the key carries the brand concept's id from the RxNorm
	 * brand table; it resolves to the ingredient concept that lists the brand
	 * among its trade names.
	 */
	public static LookupRecord brand(String brandConceptId, String ingredientConceptId) {
		return of(ItemType.RX_BRAND, brandConceptId, ingredientConceptId, SourceName.RXNORM);
	}
}
