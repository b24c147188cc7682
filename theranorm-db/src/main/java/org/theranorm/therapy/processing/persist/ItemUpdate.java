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

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.theranorm.therapy.om.IdentifierKind;

/**
 * Attribute changes to one stored identity item: identifier lists to set and
 * identifier attributes to remove. An attribute is never both set and removed.
 */
public final class ItemUpdate {

	private final Map<IdentifierKind, List<String>> sets;
	private final Set<IdentifierKind> removals;

	private ItemUpdate(Map<IdentifierKind, List<String>> sets, Set<IdentifierKind> removals) {
		this.sets = Collections.unmodifiableMap(sets);
		this.removals = Collections.unmodifiableSet(removals);
	}

	public static ItemUpdate set(Map<IdentifierKind, List<String>> values) {
		Map<IdentifierKind, List<String>> copy = new EnumMap<>(IdentifierKind.class);
		values.forEach((k, v) -> {
			if (v == null || v.isEmpty()) {
				throw new IllegalArgumentException("use remove() for an empty " + k.getAttribute());
			}
			copy.put(k, List.copyOf(v));
		});
		return new ItemUpdate(copy, EnumSet.noneOf(IdentifierKind.class));
	}

	public static ItemUpdate remove(Set<IdentifierKind> kinds) {
		return new ItemUpdate(new EnumMap<>(IdentifierKind.class),
				kinds.isEmpty() ? EnumSet.noneOf(IdentifierKind.class) : EnumSet.copyOf(kinds));
	}

	public Map<IdentifierKind, List<String>> getSets() {
		return sets;
	}

	public Set<IdentifierKind> getRemovals() {
		return removals;
	}

	public boolean isEmpty() {
		return sets.isEmpty() && removals.isEmpty();
	}

	@Override
	public String toString() {
		return "ItemUpdate{set=" + sets + ", remove=" + removals + "}";
	}
}
