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
import java.util.Collections;
import java.util.List;

import org.theranorm.therapy.om.ItemKey;

import lombok.Getter;
import lombok.ToString;

/** Per-item outcome of an index writer run. */
@Getter
@ToString
public class WriteReport {

	/** One item that could not be written. */
	public record Failure(ItemKey key, String reason) {
	}

	private int written;
	/** Lookups not written because their identity item failed. */
	private int skipped;
	private final List<Failure> failures = new ArrayList<>();

	void written() {
		written++;
	}

	void skipped(int n) {
		skipped += n;
	}

	void failed(ItemKey key, String reason) {
		failures.add(new Failure(key, reason));
	}

	public List<Failure> getFailures() {
		return Collections.unmodifiableList(failures);
	}

	public int getFailed() {
		return failures.size();
	}
}
