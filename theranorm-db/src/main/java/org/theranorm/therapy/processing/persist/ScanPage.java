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

import java.util.List;

import org.theranorm.therapy.om.IndexItem;

/**
 * One page of a scan.
 *
 * @param items        matching items, in key order
 * @param continuation opaque token for the next page; {@code null} on the last page
 */
public record ScanPage(List<IndexItem> items, String continuation) {

	public ScanPage {
		items = List.copyOf(items);
	}

	public boolean hasMore() {
		return continuation != null;
	}
}
