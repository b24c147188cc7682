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

import java.util.Comparator;
import java.util.Objects;

/** Primary key of an index item. */
public record ItemKey(String labelAndType, String conceptId) implements Comparable<ItemKey> {

	private static final Comparator<ItemKey> ORDER =
			Comparator.comparing(ItemKey::labelAndType).thenComparing(ItemKey::conceptId);

	public ItemKey {
		Objects.requireNonNull(labelAndType, "labelAndType");
		Objects.requireNonNull(conceptId, "conceptId");
	}

	@Override
	public int compareTo(ItemKey o) {
		return ORDER.compare(this, o);
	}
}
