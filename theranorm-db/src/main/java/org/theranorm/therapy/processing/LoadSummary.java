package org.theranorm.therapy.processing;

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

import org.theranorm.therapy.om.SourceName;

import lombok.Data;

/** Outcome of loading one source. */
@Data
public class LoadSummary {

	private final SourceName source;
	private int concepts;
	/** Rows or entities dropped as malformed during transform. */
	private int skipped;
	private int written;
	private int failed;
	/** Lookups not written because their identity item failed. */
	private int lookupsSkipped;
	private boolean metadataWritten;
	/** Reason the source could not be loaded at all; {@code null} otherwise. */
	private String fatalError;

	public boolean isSuccessful() {
		return fatalError == null;
	}

	/** One-line form for the load log. */
	public String describe() {
		if (!isSuccessful()) {
			return source + ": FAILED (" + fatalError + ")";
		}
		return String.format("%s: %,d concepts, %,d skipped, %,d items written, %,d failed, %,d lookups skipped%s",
				source, concepts, skipped, written, failed, lookupsSkipped, metadataWritten ? "" : ", metadata not written");
	}
}
