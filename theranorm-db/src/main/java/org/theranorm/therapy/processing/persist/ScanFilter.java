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

import org.theranorm.therapy.om.IndexItem;
import org.theranorm.therapy.om.ItemType;

/**
 * Scan predicate.
 *
 * @param itemType        only items of this type; {@code null} for any
 * @param excludedSrcName skip items of this {@code src_name}; {@code null} for none
 */
public record ScanFilter(ItemType itemType, String excludedSrcName) {

	public static final ScanFilter ALL = new ScanFilter(null, null);

	/** Identity items of every source except {@code srcName}. */
	public static ScanFilter identitiesExcept(String srcName) {
		return new ScanFilter(ItemType.IDENTITY, srcName);
	}

	public boolean matches(IndexItem item) {
		return (itemType == null || itemType == item.getItemType())
				&& (excludedSrcName == null || !excludedSrcName.equals(item.getSrcName()));
	}
}
