package org.theranorm.therapy.etl;

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

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.theranorm.therapy.classify.IdentifierClassifier;
import org.theranorm.therapy.om.ConceptRecord;
import org.theranorm.therapy.om.IdentifierKind;
import org.theranorm.therapy.om.NamespacePrefix;
import org.theranorm.therapy.om.SourceMetadata;
import org.theranorm.therapy.om.SourceMetadata.LicenseAttributes;
import org.theranorm.therapy.om.SourceName;
import org.theranorm.therapy.util.Logger;
import org.theranorm.therapy.util.SourceFiles.SourceFile;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Knowledge graph. Reads the saved SPARQL result (a JSON array of flat string
 * records, one per item/alias combination) and groups rows by item.
 */
public class WikidataSource extends AbstractFileSource<List<Map<String, String>>> {

	private static final TypeReference<List<Map<String, String>>> ROWS = new TypeReference<>() {
	};

	/** Identifier fields of a row and the namespace each maps to. */
	static final Map<String, NamespacePrefix> IDENTIFIER_FIELDS;

	static {
		Map<String, NamespacePrefix> m = new LinkedHashMap<>();
		m.put("casRegistry", NamespacePrefix.CHEMIDPLUS);
		m.put("pubchemCompound", NamespacePrefix.PUBCHEMCOMPOUND);
		m.put("pubchemSubstance", NamespacePrefix.PUBCHEMSUBSTANCE);
		m.put("chembl", NamespacePrefix.CHEMBL);
		m.put("rxnorm", NamespacePrefix.RXNORM);
		m.put("drugbank", NamespacePrefix.DRUGBANK);
		IDENTIFIER_FIELDS = Collections.unmodifiableMap(m);
	}

	private final ObjectMapper mapper;

	public WikidataSource(Path dataDir, IdentifierClassifier classifier, SourceRetriever retriever) {
		this(dataDir, classifier, retriever, new ObjectMapper());
	}

	WikidataSource(Path dataDir, IdentifierClassifier classifier, SourceRetriever retriever, ObjectMapper mapper) {
		super(dataDir, classifier, retriever);
		this.mapper = mapper;
	}

	@Override
	public SourceName getSourceName() {
		return SourceName.WIKIDATA;
	}

	@Override
	public List<Map<String, String>> extract() throws SourceUnavailableException {
		SourceFile file = locate("wikidata", "json");
		try {
			return mapper.readValue(file.path().toFile(), ROWS);
		} catch (IOException e) {
			throw new SourceUnavailableException(SourceName.WIKIDATA, "cannot decode " + file.path(), e);
		}
	}

	@Override
	public TransformResult transform(List<Map<String, String>> rows) {
		Map<String, ConceptRecord.Builder> items = new LinkedHashMap<>();
		int skipped = 0;

		for (Map<String, String> row : rows) {
			String conceptId;
			try {
				conceptId = conceptId(row);
			} catch (MalformedRecordException e) {
				Logger.warn("Wikidata: {}; skipped", e.getMessage());
				skipped++;
				continue;
			}
			ConceptRecord.Builder b = items.get(conceptId);
			if (b == null) {
				b = ConceptRecord.builder(conceptId, SourceName.WIKIDATA);
				b.label(row.get("itemLabel"));
				for (Map.Entry<String, NamespacePrefix> field : IDENTIFIER_FIELDS.entrySet()) {
					String value = row.get(field.getKey());
					if (StringUtils.isNotBlank(value)) {
						addIdentifier(b, field.getValue(), value.trim());
					}
				}
				items.put(conceptId, b);
			}
			b.alias(row.get("alias"));
		}

		List<ConceptRecord> out = new ArrayList<>(items.size());
		items.values().forEach(b -> out.add(b.build()));
		Logger.info("Wikidata: {} concepts from {} rows, {} skipped", out.size(), rows.size(), skipped);
		return TransformResult.of(out, skipped);
	}

	/** {@code wikidata:Q...} from the last path segment of the item URI. */
	static String conceptId(Map<String, String> row) throws MalformedRecordException {
		String item = row.get("item");
		if (StringUtils.isBlank(item)) {
			throw new MalformedRecordException("row without item");
		}
		String local = StringUtils.substringAfterLast(item.trim(), "/");
		if (local.isEmpty()) {
			local = item.trim();
		}
		if (local.isEmpty() || local.endsWith("/")) {
			throw new MalformedRecordException("unusable item '" + item + "'");
		}
		return NamespacePrefix.WIKIDATA.curie(local);
	}

	/**
	 * Identifiers into a loaded namespace gain that source's id infix (e.g.
	 * {@code drugbank:DB00945} from {@code 00945}); ChEMBL values already carry
	 * theirs.
	 */
	private void addIdentifier(ConceptRecord.Builder b, NamespacePrefix prefix, String value) {
		IdentifierKind kind = classifier.classify(prefix.getValue());
		String local = value;
		if (kind == IdentifierKind.OTHER_IDENTIFIER && prefix != NamespacePrefix.CHEMBL) {
			SourceName src = SourceName.forPrefix(prefix);
			if (src != null) {
				local = src.getIdInfix() + value;
			}
		}
		b.identifier(prefix.curie(local), kind);
	}

	@Override
	public SourceMetadata metadata() {
		return new SourceMetadata(SourceName.WIKIDATA, "CC0 1.0", "https://creativecommons.org/publicdomain/zero/1.0/",
				getVersion(), null, null, new LicenseAttributes(false, false, false));
	}
}
