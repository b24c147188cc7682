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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.theranorm.therapy.classify.IdentifierClassifier;
import org.theranorm.therapy.om.ConceptRecord;

class WikidataSourceTest {

	private static final String JSON = "[\n"
			+ " {\"item\": \"http://www.wikidata.org/entity/Q18216\", \"itemLabel\": \"aspirin\",\n"
			+ "  \"alias\": \"acetylsalicylic acid\", \"casRegistry\": \"50-78-2\", \"pubchemCompound\": \"2244\",\n"
			+ "  \"chembl\": \"CHEMBL25\", \"rxnorm\": \"1191\", \"drugbank\": \"00945\"},\n"
			+ " {\"item\": \"http://www.wikidata.org/entity/Q18216\", \"itemLabel\": \"aspirin\", \"alias\": \"ASA\"},\n"
			+ " {\"itemLabel\": \"no item\"},\n"
			+ " {\"item\": \"http://www.wikidata.org/entity/Q57055\", \"itemLabel\": \"paracetamol\"}\n"
			+ "]";

	@TempDir
	Path dataDir;

	private WikidataSource source() {
		return new WikidataSource(dataDir, IdentifierClassifier.standard(), null);
	}

	@Test
	void groupsRowsByItem() throws Exception {
		Files.writeString(dataDir.resolve("wikidata_20250301.json"), JSON, StandardCharsets.UTF_8);
		WikidataSource src = source();

		TransformResult result = src.transform(src.extract());

		assertEquals(2, result.concepts().size());
		assertEquals(1, result.skipped());

		ConceptRecord aspirin = result.concepts().get(0);
		assertEquals("wikidata:Q18216", aspirin.getConceptId());
		assertEquals("aspirin", aspirin.getLabel().get());
		assertEquals(Set.of("acetylsalicylic acid", "ASA"), aspirin.getAliases());
		assertEquals(Set.of("chemidplus:50-78-2", "chembl:CHEMBL25", "rxcui:1191", "drugbank:DB00945"),
				aspirin.getOtherIdentifiers());
		assertEquals(Set.of("pubchem.compound:2244"), aspirin.getXrefs());

		ConceptRecord paracetamol = result.concepts().get(1);
		assertTrue(paracetamol.getAliases().isEmpty());
		assertTrue(paracetamol.getOtherIdentifiers().isEmpty());
		assertEquals("20250301", src.metadata().getVersion());
		assertFalse(src.metadata().getLicenseAttributes().isAttribution());
	}

	@Test
	void conceptIdIsLastUriSegment() throws Exception {
		assertEquals("wikidata:Q1", WikidataSource.conceptId(Map.of("item", "http://www.wikidata.org/entity/Q1")));
		assertEquals("wikidata:Q2", WikidataSource.conceptId(Map.of("item", "Q2")));
		assertThrows(MalformedRecordException.class, () -> WikidataSource.conceptId(Map.of("item", " ")));
		assertThrows(MalformedRecordException.class,
				() -> WikidataSource.conceptId(Map.of("item", "http://www.wikidata.org/entity/")));
	}

	@Test
	void undecodableFileIsUnavailable() throws Exception {
		Files.writeString(dataDir.resolve("wikidata_20250301.json"), "{not json", StandardCharsets.UTF_8);
		assertThrows(SourceUnavailableException.class, () -> source().extract());
	}

	@Test
	void transformOfNoRowsIsEmpty() {
		TransformResult result = source().transform(List.of());
		assertTrue(result.concepts().isEmpty());
		assertEquals(0, result.skipped());
	}
}
