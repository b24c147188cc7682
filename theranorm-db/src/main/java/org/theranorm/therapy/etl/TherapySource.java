package org.theranorm.therapy.etl;

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

import org.theranorm.therapy.om.SourceMetadata;
import org.theranorm.therapy.om.SourceName;

/**
 * One therapy source: obtain the raw artifact, turn it into concept records
 * and describe its provenance.
 *
 * @param <R> raw artifact handed from {@link #extract()} to {@link #transform(Object)}
 */
public interface TherapySource<R> {

	SourceName getSourceName();

	/**
	 * Locate (or have retrieved) and open the raw artifact.
	 *
	 * @throws SourceUnavailableException when no artifact can be obtained or opened
	 */
	R extract() throws SourceUnavailableException;

	/**
	 * Build the concept records. Malformed rows are logged, counted and skipped;
	 * they never abort the transform.
	 */
	TransformResult transform(R raw);

	/** Provenance of the loaded artifact; valid after {@link #extract()}. */
	SourceMetadata metadata();
}
