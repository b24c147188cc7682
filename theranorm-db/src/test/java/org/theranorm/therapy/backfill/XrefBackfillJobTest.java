package org.theranorm.therapy.backfill;

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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.theranorm.therapy.classify.IdentifierClassifier;
import org.theranorm.therapy.om.IndexItem;
import org.theranorm.therapy.om.ItemKey;
import org.theranorm.therapy.om.ItemType;
import org.theranorm.therapy.processing.persist.InMemoryConceptSink;
import org.theranorm.therapy.processing.persist.SinkWriteException;

class XrefBackfillJobTest {

	private InMemoryConceptSink sink;

	@BeforeEach
	void setUp() {
		sink = new InMemoryConceptSink(2);
	}

	private IndexItem put(String conceptId, String src, List<String> others, List<String> xrefs) throws Exception {
		IndexItem item = new IndexItem();
		item.setLabelAndType(conceptId.toLowerCase() + "##identity");
		item.setConceptId(conceptId);
		item.setItemType(ItemType.IDENTITY);
		item.setSrcName(src);
		item.setOtherIdentifiers(others);
		item.setXrefs(xrefs);
		sink.put(item);
		return item;
	}

	private IndexItem read(IndexItem item) {
		return sink.get(item.key()).orElseThrow();
	}

	@Test
	void misfiledIdentifiersMoveAndSecondRunWritesNothing() throws Exception {
		IndexItem wd = put("wikidata:Q18216", "Wikidata", List.of("pubchem.compound:2244"),
				List.of("chembl:CHEMBL25", "drugbank:DB00945", "chembl:CHEMBL25"));
		IndexItem rx = put("rxcui:1191", "RxNorm", List.of("drugbank:DB00945"), List.of("atc:N02BA01"));

		BackfillResult first = new XrefBackfillJob(sink, IdentifierClassifier.standard()).run();

		assertEquals(List.of("chembl:CHEMBL25", "drugbank:DB00945"), read(wd).getOtherIdentifiers());
		assertEquals(List.of("pubchem.compound:2244"), read(wd).getXrefs());
		assertEquals(List.of("drugbank:DB00945"), read(rx).getOtherIdentifiers());
		assertEquals(1, first.getUpdated());
		assertEquals(2, first.getScanned());

		BackfillResult second = new XrefBackfillJob(sink, IdentifierClassifier.standard()).run();
		assertEquals(0, second.getWrites());
	}

	@Test
	void listThatEndsUpEmptyIsRemoved() throws Exception {
		IndexItem item = put("drugbank:DB00001", "DrugBank", List.of("chebi:15365"), new ArrayList<>());

		BackfillResult result = new XrefBackfillJob(sink, IdentifierClassifier.standard()).run();

		assertNull(read(item).getOtherIdentifiers());
		assertEquals(List.of("chebi:15365"), read(item).getXrefs());
		assertEquals(1, result.getUpdated());
		assertEquals(1, result.getRemovals());
	}

	@Test
	void chemblAndLookupItemsAreNotTouched() throws Exception {
		IndexItem chembl = put("chembl:CHEMBL25", "ChEMBL", null, List.of("drugbank:DB00945"));
		IndexItem lookup = new IndexItem();
		lookup.setLabelAndType("aspirin##label");
		lookup.setConceptId("wikidata:q18216");
		lookup.setItemType(ItemType.LABEL);
		lookup.setSrcName("Wikidata");
		sink.put(lookup);

		BackfillResult result = new XrefBackfillJob(sink, IdentifierClassifier.standard()).run();

		assertEquals(0, result.getScanned());
		assertEquals(List.of("drugbank:DB00945"), read(chembl).getXrefs());
	}

	@Test
	void resumesAfterCheckpoint() throws Exception {
		for (int i = 1; i <= 5; i++) {
			put("rxcui:" + i, "RxNorm", null, List.of("drugbank:DB0000" + i));
		}
		List<String> checkpoints = new ArrayList<>();
		new XrefBackfillJob(sink, IdentifierClassifier.standard()).onCheckpoint(checkpoints::add).run();

		assertEquals(3, checkpoints.size());
		assertNull(checkpoints.get(2));

		// re-mis-file the last two items and resume after the first page
		put("rxcui:4", "RxNorm", null, List.of("drugbank:DB00004"));
		put("rxcui:5", "RxNorm", null, List.of("drugbank:DB00005"));
		BackfillResult resumed = new XrefBackfillJob(sink, IdentifierClassifier.standard()).run(checkpoints.get(0));

		assertEquals(3, resumed.getScanned());
		assertEquals(2, resumed.getUpdated());
		assertNull(resumed.getLastContinuation());
	}

	@Test
	void failedUpdateIsCountedAndRunContinues() throws Exception {
		InMemoryConceptSink spied = spy(new InMemoryConceptSink(10));
		sink = spied;
		IndexItem bad = put("rxcui:1", "RxNorm", null, List.of("drugbank:DB00001"));
		IndexItem good = put("rxcui:2", "RxNorm", null, List.of("drugbank:DB00002"));
		doThrow(new SinkWriteException(bad.key(), "throttled")).when(spied).update(eq(bad.key()), any());

		BackfillResult result = new XrefBackfillJob(spied, IdentifierClassifier.standard()).run();

		assertEquals(1, result.getFailed());
		assertEquals(List.of("drugbank:DB00002"), read(good).getOtherIdentifiers());
		assertTrue(sink.get(new ItemKey("rxcui:1##identity", "rxcui:1")).isPresent());
	}
}
