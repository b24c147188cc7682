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

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Namespace prefixes used in concept ids, other identifiers and xrefs
 * ({@code <prefix>:<local id>}).
 */
public enum NamespacePrefix {

	// sources ingested by this normalizer
	CHEMBL("chembl"),
	DRUGBANK("drugbank"),
	RXNORM("rxcui"),
	WIKIDATA("wikidata"),
	CHEMIDPLUS("chemidplus"),
	NCIT("ncit"),

	// cited only
	CHEBI("chebi"),
	PUBCHEMCOMPOUND("pubchem.compound"),
	PUBCHEMSUBSTANCE("pubchem.substance"),
	KEGGCOMPOUND("kegg.compound"),
	KEGGDRUG("kegg.drug"),
	CHEMSPIDER("chemspider"),
	BINDINGDB("bindingdb"),
	PHARMGKB("pharmgkb.drug"),
	ZINC("zinc"),
	PDB("pdb"),
	THERAPEUTICTARGETSDB("ttd"),
	IUPHAR("iuphar.ligand"),
	GUIDETOPHARMACOLOGY("gtopdb"),
	ATC("atc"),
	CVX("cvx"),
	MMSL("mmsl"),
	MSH("mesh"),
	MTHCMSFRF("mthcmsfrf"),
	UNII("unii"),
	USP("usp"),
	VANDF("vandf");

	private static final Map<String, NamespacePrefix> BY_VALUE = new HashMap<>();

	static {
		for (NamespacePrefix p : values()) {
			BY_VALUE.put(p.value, p);
		}
	}

	private final String value;

	NamespacePrefix(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	/** Namespaced identifier {@code <prefix>:<localId>}. */
	public String curie(String localId) {
		return value + ":" + localId;
	}

	/** Prefix for a namespace string, case-insensitive; {@code null} when unknown. */
	public static NamespacePrefix fromValue(String namespace) {
		return namespace == null ? null : BY_VALUE.get(namespace.trim().toLowerCase(Locale.ROOT));
	}

	/** Text before the first {@code ':'} of an identifier; the whole string when there is none. */
	public static String namespaceOf(String identifier) {
		if (identifier == null) {
			return "";
		}
		int idx = identifier.indexOf(':');
		return idx < 0 ? identifier : identifier.substring(0, idx);
	}
}
