package org.theranorm.therapy.etl.rxnorm;

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

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.theranorm.therapy.classify.IdentifierClassifier;
import org.theranorm.therapy.etl.TransformResult;
import org.theranorm.therapy.om.ApprovalRating;
import org.theranorm.therapy.om.ConceptRecord;
import org.theranorm.therapy.om.ItemType;
import org.theranorm.therapy.om.LookupRecord;

class RxNormLinkerTest {

	private RxNormLinker linker;

	@BeforeEach
	void setUp() {
		linker = new RxNormLinker(IdentifierClassifier.standard(), List.of("Tablet", "Oral Tablet"));
	}

	private static RrfRow row(String rxcui, String sab, String tty, String code, String str) {
		return new RrfRow(rxcui, sab, tty, code, str, "");
	}

	private static Map<String, ConceptRecord> byId(TransformResult result) {
		return result.concepts().stream().collect(Collectors.toMap(ConceptRecord::getConceptId, Function.identity()));
	}

	@Test
	@DisplayName("Aspirin/Bufferin: ingredient gains brand, brand concept links back")
	void ingredientBrandLink() {
		linker.accept(new RrfRow("1", "RXNORM", "IN", "1", "Aspirin", "4096"));
		linker.accept(row("3", "RXNORM", "BN", "3", "Bufferin"));
		linker.accept(row("5", "RXNORM", "SBDC", "5", "Aspirin 325 MG [Bufferin]"));

		TransformResult result = linker.link(0);

		Map<String, ConceptRecord> concepts = byId(result);
		assertEquals(Set.of("rxcui:1"), concepts.keySet(), "brand concept has no label and is dropped");
		ConceptRecord aspirin = concepts.get("rxcui:1");
		assertEquals("Aspirin", aspirin.getLabel().get());
		assertEquals(Set.of("Bufferin"), aspirin.getTradeNames());
		assertEquals(Set.of(ApprovalRating.RXNORM_PRESCRIBABLE), aspirin.getApprovalRatings());

		assertEquals(1, result.extraLookups().size());
		LookupRecord link = result.extraLookups().get(0);
		assertEquals("rxcui:3##rx_brand", link.key());
		assertEquals("rxcui:1", link.conceptId());
		assertEquals(ItemType.RX_BRAND, link.itemType());
		assertEquals(0, result.skipped());
	}

	@Test
	void rowOrderDoesNotMatter() {
		linker.accept(row("5", "RXNORM", "SBDC", "5", "Aspirin 325 MG [Bufferin]"));
		linker.accept(row("3", "RXNORM", "BN", "3", "Bufferin"));
		linker.accept(row("1", "RXNORM", "IN", "1", "Aspirin"));

		TransformResult result = linker.link(0);
		assertEquals(Set.of("Bufferin"), byId(result).get("rxcui:1").getTradeNames());
		assertEquals(1, result.extraLookups().size());
	}

	@Test
	void ingredientMatchIsCaseInsensitive() {
		linker.accept(row("1", "RXNORM", "IN", "1", "aspirin"));
		linker.accept(row("5", "RXNORM", "SBDC", "5", "ASPIRIN 325 MG [Bufferin]"));

		assertEquals(Set.of("Bufferin"), byId(linker.link(0)).get("rxcui:1").getTradeNames());
	}

	@Test
	void preciseIngredientBrandsReachTheBaseIngredient() {
		linker.accept(row("10", "RXNORM", "IN", "10", "Morphine"));
		linker.accept(row("10", "MSH", "MH", "D009020", "Morphine"));
		linker.accept(row("11", "MSH", "PEP", "D009020", "Morphine Sulfate"));
		linker.accept(row("12", "RXNORM", "SBDC", "12", "Morphine Sulfate 15 MG [MS Contin]"));

		ConceptRecord morphine = byId(linker.link(0)).get("rxcui:10");
		assertEquals(Set.of("MS Contin"), morphine.getTradeNames());
		assertTrue(morphine.getXrefs().contains("mesh:D009020"));
	}

	@Test
	void brandedDrugFormAddsTradeName() {
		linker.accept(row("2", "RXNORM", "IN", "2", "Ibuprofen"));
		linker.accept(row("8", "RXNORM", "BN", "8", "Advil"));
		linker.accept(row("7", "RXNORM", "SBDF", "7", "Ibuprofen Oral Tablet [Advil]"));

		TransformResult result = linker.link(0);
		assertEquals(Set.of("Advil"), byId(result).get("rxcui:2").getTradeNames());
		assertEquals("rxcui:8##rx_brand", result.extraLookups().get(0).key());
		assertEquals("rxcui:2", result.extraLookups().get(0).conceptId());
	}

	@Test
	void termsFillAliasesTradeNamesAndCrossReferences() {
		linker.accept(row("1", "RXNORM", "IN", "1", "Aspirin"));
		linker.accept(row("1", "RXNORM", "SY", "1", "Acetylsalicylic Acid"));
		linker.accept(row("1", "MTHSPL", "SU", "R16CO5Y76E", "ASPIRIN"));
		linker.accept(row("1", "DRUGBANK", "IN", "DB00945", "Aspirin"));
		linker.accept(row("1", "ATC", "RXN_PT", "N02BA01", "aspirin"));
		linker.accept(row("1", "VANDF", "BN", "4017536", "Ecotrin"));
		linker.accept(row("1", "SNOMEDCT_US", "PT", "387458008", "Aspirin (substance)"));

		ConceptRecord aspirin = byId(linker.link(0)).get("rxcui:1");
		assertEquals(Set.of("Acetylsalicylic Acid", "aspirin"), aspirin.getAliases());
		assertEquals(Set.of("Ecotrin"), aspirin.getTradeNames());
		assertEquals(Set.of("drugbank:DB00945"), aspirin.getOtherIdentifiers());
		assertEquals(Set.of("unii:R16CO5Y76E", "atc:N02BA01", "vandf:4017536"), aspirin.getXrefs());
		assertTrue(aspirin.getApprovalRatings().isEmpty());
	}

	@Test
	void ownRxcuiIsNotACrossReference() {
		linker.accept(row("1", "RXNORM", "IN", "1", "Aspirin"));
		linker.accept(row("1", "MMSL", "GN", "NOCODE", "aspirin"));

		ConceptRecord aspirin = byId(linker.link(0)).get("rxcui:1");
		assertFalse(aspirin.getOtherIdentifiers().contains("rxcui:1"));
		assertTrue(aspirin.getXrefs().isEmpty());
	}

	@Test
	void unbracketedComponentsAreCountedAsSkipped() {
		linker.accept(row("1", "RXNORM", "IN", "1", "Aspirin"));
		linker.accept(row("5", "RXNORM", "SBDC", "5", "Aspirin 325 MG"));

		TransformResult result = linker.link(2);
		assertEquals(3, result.skipped());
		assertTrue(byId(result).get("rxcui:1").getTradeNames().isEmpty());
	}

	@Test
	void linkingTwiceIsRejected() {
		linker.link(0);
		assertThrows(IllegalStateException.class, () -> linker.link(0));
		assertThrows(IllegalStateException.class, () -> linker.accept(row("1", "RXNORM", "IN", "1", "Aspirin")));
	}
}
