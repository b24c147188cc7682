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

/**
 * Record kinds stored in the flat index. The tag is appended to the lookup
 * string to form the key, e.g. {@code aspirin##label}.
 */
public enum ItemType {

	IDENTITY("identity"),
	LABEL("label"),
	ALIAS("alias"),
	TRADE_NAME("trade_name"),
	RX_BRAND("rx_brand");

	public static final String KEY_SEPARATOR = "##";

	private final String tag;

	ItemType(String tag) {
		this.tag = tag;
	}

	public String getTag() {
		return tag;
	}

	/** Index key for a lookup string: lowercased value, separator, tag. */
	public String key(String value) {
		return TermSets.lower(value) + KEY_SEPARATOR + tag;
	}

	public static ItemType fromTag(String tag) {
		for (ItemType t : values()) {
			if (t.tag.equals(tag)) {
				return t;
			}
		}
		throw new IllegalArgumentException("Unknown item type: " + tag);
	}
}
