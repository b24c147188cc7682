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

import java.util.List;

import org.theranorm.therapy.om.ConceptRecord;
import org.theranorm.therapy.om.LookupRecord;

/**
 * Output of one transform.
 *
 * @param concepts     identity records, in source order
 * @param extraLookups lookups not derivable from a record alone (brand associations)
 * @param skipped      rows or entities dropped as malformed
 */
public record TransformResult(List<ConceptRecord> concepts, List<LookupRecord> extraLookups, int skipped) {

	public TransformResult {
		concepts = List.copyOf(concepts);
		extraLookups = List.copyOf(extraLookups);
	}

	public static TransformResult of(List<ConceptRecord> concepts, int skipped) {
		return new TransformResult(concepts, List.of(), skipped);
	}
}
