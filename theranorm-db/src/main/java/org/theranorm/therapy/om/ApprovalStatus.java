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

import java.util.Locale;

/** Regulatory approval status of a concept. Absence means the source states none. */
public enum ApprovalStatus {

	WITHDRAWN("withdrawn"),
	APPROVED("approved"),
	INVESTIGATIONAL("investigational"),
	UNKNOWN("unknown");

	private final String value;

	ApprovalStatus(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	/** Parse a stored value; anything unrecognized maps to {@link #UNKNOWN}, {@code null} stays {@code null}. */
	public static ApprovalStatus fromValue(String value) {
		if (value == null) {
			return null;
		}
		String v = value.trim().toLowerCase(Locale.ROOT);
		for (ApprovalStatus s : values()) {
			if (s.value.equals(v)) {
				return s;
			}
		}
		return UNKNOWN;
	}
}
