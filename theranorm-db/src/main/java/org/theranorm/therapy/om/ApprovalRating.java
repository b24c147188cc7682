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

/** Source-specific approval flags. */
public enum ApprovalRating {

	/** RxNorm ingredient flagged as part of the current prescribable content (CVF 4096). */
	RXNORM_PRESCRIBABLE("rxnorm_prescribable");

	private final String value;

	ApprovalRating(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	public static ApprovalRating fromValue(String value) {
		for (ApprovalRating r : values()) {
			if (r.value.equals(value)) {
				return r;
			}
		}
		return null;
	}
}
