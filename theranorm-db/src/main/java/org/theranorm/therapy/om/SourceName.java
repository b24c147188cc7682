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

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Sources whose concepts live in the normalized space. The namespace of each
 * is "normalizer-native": an identifier in it resolves to another concept of
 * this index.
 */
public enum SourceName {

	CHEMBL("ChEMBL", NamespacePrefix.CHEMBL, "CHEMBL", true),
	DRUGBANK("DrugBank", NamespacePrefix.DRUGBANK, "DB", true),
	RXNORM("RxNorm", NamespacePrefix.RXNORM, "", true),
	WIKIDATA("Wikidata", NamespacePrefix.WIKIDATA, "Q", true),
	// native namespaces without a loader in this module
	CHEMIDPLUS("ChemIDplus", NamespacePrefix.CHEMIDPLUS, "", false),
	NCIT("NCIt", NamespacePrefix.NCIT, "C", false);

	private final String displayName;
	private final NamespacePrefix prefix;
	private final String idInfix;
	private final boolean loadable;

	SourceName(String displayName, NamespacePrefix prefix, String idInfix, boolean loadable) {
		this.displayName = displayName;
		this.prefix = prefix;
		this.idInfix = idInfix;
		this.loadable = loadable;
	}

	/** Stored {@code src_name} value, e.g. "DrugBank". */
	public String getDisplayName() {
		return displayName;
	}

	public NamespacePrefix getPrefix() {
		return prefix;
	}

	/**
	 * Token that precedes the local id in this source's own ids, e.g. "DB" in
	 * {@code drugbank:DB00945}. Other sources sometimes cite the bare number.
	 */
	public String getIdInfix() {
		return idInfix;
	}

	public boolean isLoadable() {
		return loadable;
	}

	public static Set<SourceName> loadable() {
		Set<SourceName> out = EnumSet.noneOf(SourceName.class);
		for (SourceName s : values()) {
			if (s.loadable) {
				out.add(s);
			}
		}
		return out;
	}

	/** Match on enum name or display name, case-insensitive; {@code null} when unknown. */
	public static SourceName fromName(String name) {
		if (name == null) {
			return null;
		}
		String n = name.trim();
		for (SourceName s : values()) {
			if (s.name().equalsIgnoreCase(n) || s.displayName.toLowerCase(Locale.ROOT).equals(n.toLowerCase(Locale.ROOT))) {
				return s;
			}
		}
		return null;
	}

	/** Source owning a namespace prefix; {@code null} for cited-only namespaces. */
	public static SourceName forPrefix(NamespacePrefix prefix) {
		for (SourceName s : values()) {
			if (s.prefix == prefix) {
				return s;
			}
		}
		return null;
	}

	@Override
	public String toString() {
		return displayName;
	}
}
