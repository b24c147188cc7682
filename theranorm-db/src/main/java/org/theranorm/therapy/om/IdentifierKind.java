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

/** Where a cross-reference is filed on an identity record. */
public enum IdentifierKind {

	/** Resolves to another concept of this normalized index. */
	OTHER_IDENTIFIER("other_identifiers"),

	/** Points into a namespace the normalizer does not load; informational only. */
	XREF("xrefs");

	private final String attribute;

	IdentifierKind(String attribute) {
		this.attribute = attribute;
	}

	/** Stored attribute name. */
	public String getAttribute() {
		return attribute;
	}
}
