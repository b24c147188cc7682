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

import java.util.ArrayList;
import java.util.List;

/** Derives the lookup records owned by an identity record. */
public final class LookupRecords {

	private LookupRecords() {
	}

	/**
	 * One label lookup plus one lookup per distinct lowercased alias and trade
	 * name. Brand associations are not derivable from the record and are
	 * emitted by the RxNorm linker.
	 */
	public static List<LookupRecord> derive(ConceptRecord record) {
		List<LookupRecord> out = new ArrayList<>();
		String id = record.getConceptId();
		SourceName src = record.getSourceName();

		record.getLabel().ifPresent(l -> out.add(LookupRecord.of(ItemType.LABEL, l, id, src)));
		for (String alias : TermSets.lowered(record.getAliases())) {
			out.add(LookupRecord.of(ItemType.ALIAS, alias, id, src));
		}
		for (String tn : TermSets.lowered(record.getTradeNames())) {
			out.add(LookupRecord.of(ItemType.TRADE_NAME, tn, id, src));
		}
		return out;
	}
}
