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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

/**
 * Case handling and fan-out rules for list attributes (aliases, trade names).
 *
 * <p>Uniqueness is decided on the case-folded form; lookup keys are stored
 * fully lowercased.</p>
 */
public final class TermSets {

	/** Max distinct case-folded values before a whole attribute is dropped. */
	public static final int FAN_OUT_CAP = 20;

	private static final char DOTLESS_I = '\u0131';

	private TermSets() {
	}

	/**
	 * Locale-independent full case folding ("Straße" and "STRASSE" fold to
	 * the same value). Dotless i (U+0131) is kept as is, so "Dıclofenac" and
	 * "Diclofenac" stay distinct.
	 */
	public static String fold(String s) {
		if (s == null) {
			return null;
		}
		if (s.indexOf(DOTLESS_I) < 0) {
			return s.toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT);
		}
		StringBuilder out = new StringBuilder(s.length());
		int from = 0;
		for (int at = s.indexOf(DOTLESS_I); at >= 0; at = s.indexOf(DOTLESS_I, from)) {
			out.append(s.substring(from, at).toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT)).append(DOTLESS_I);
			from = at + 1;
		}
		return out.append(s.substring(from).toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT)).toString();
	}

	/** Lowercase form used for stored lookup keys and concept ids. */
	public static String lower(String s) {
		return s == null ? null : s.toLowerCase(Locale.ROOT);
	}

	/**
	 * Drops blanks and case-folded duplicates, keeping the first-seen casing and
	 * order.
	 */
	public static Set<String> dedupeFolded(Collection<String> values) {
		if (values == null || values.isEmpty()) {
			return Collections.emptySet();
		}
		Map<String, String> byFolded = new LinkedHashMap<>();
		for (String v : values) {
			if (StringUtils.isBlank(v)) {
				continue;
			}
			byFolded.putIfAbsent(fold(v), v);
		}
		return new LinkedHashSet<>(byFolded.values());
	}

	/**
	 * De-duplicated values, or an empty set when more than {@link #FAN_OUT_CAP}
	 * distinct folded values remain. Never truncates.
	 */
	public static Set<String> capped(Collection<String> values) {
		Set<String> unique = dedupeFolded(values);
		if (unique.size() > FAN_OUT_CAP) {
			return Collections.emptySet();
		}
		return unique;
	}

	/** Distinct lowercased forms, in first-seen order. */
	public static Set<String> lowered(Collection<String> values) {
		Set<String> out = new LinkedHashSet<>();
		for (String v : values) {
			out.add(lower(v));
		}
		return out;
	}
}
