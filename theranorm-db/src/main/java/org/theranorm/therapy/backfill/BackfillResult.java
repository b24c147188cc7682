package org.theranorm.therapy.backfill;

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

import lombok.Data;

/** Counters of one backfill run. */
@Data
public class BackfillResult {

	private int pages;
	private int scanned;
	/** Items whose identifier lists were set. */
	private int updated;
	/** Attribute removals issued. */
	private int removals;
	private int failed;
	/** Token of the last completed page; {@code null} once the scan is exhausted. */
	private String lastContinuation;

	public int getWrites() {
		return updated + removals;
	}
}
