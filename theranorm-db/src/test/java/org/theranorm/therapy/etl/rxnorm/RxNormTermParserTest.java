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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class RxNormTermParserTest {

	@Test
	void brandIsTheLastBracketGroup() {
		assertEquals(Optional.of("Bufferin"), RxNormTermParser.brandOf("Aspirin 325 MG [Bufferin]"));
		assertEquals(Optional.of("Kwikpen"), RxNormTermParser.brandOf("Insulin Lispro 100 UNT/ML [Humalog] [Kwikpen]"));
	}

	@Test
	void noOrBlankBracketMeansNoBrand() {
		assertTrue(RxNormTermParser.brandOf("Aspirin 325 MG").isEmpty());
		assertTrue(RxNormTermParser.brandOf("Aspirin 325 MG [ ]").isEmpty());
		assertTrue(RxNormTermParser.brandOf("Aspirin [Bufferin").isEmpty());
		assertTrue(RxNormTermParser.ingredientsOf("Aspirin 325 MG").isEmpty());
	}

	@Test
	void multiIngredientComponent() {
		assertEquals(List.of("Acetaminophen", "Oxycodone Hydrochloride"),
				RxNormTermParser.ingredientsOf("Acetaminophen 325 MG / Oxycodone Hydrochloride 5 MG [Percocet]"));
	}

	@Test
	void strengthsWithDecimalsRatesAndMissingUnits() {
		assertEquals(List.of("Levothyroxine Sodium"),
				RxNormTermParser.ingredientsOf("Levothyroxine Sodium 0.025 MG [Synthroid]"));
		assertEquals(List.of("Fentanyl"), RxNormTermParser.ingredientsOf("Fentanyl 0.025 MG/HR [Duragesic]"));
		assertEquals(List.of("Zinc"), RxNormTermParser.ingredientsOf("Zinc 10 [Galzin]"));
	}

	@Test
	void earlierBracketGroupsStayInTheBody() {
		assertEquals(List.of("Insulin Lispro [Humalog]"),
				RxNormTermParser.ingredientsOf("Insulin Lispro 100 UNT/ML [Humalog] [Kwikpen]"));
	}

	@Test
	void strengthIsNeverRemovedFromTheBrand() {
		assertEquals(Optional.of("Tylenol 8 HR"), RxNormTermParser.brandOf("Acetaminophen 650 MG [Tylenol 8 HR]"));
	}

	@Test
	void sbdfPrefersTheLongestDrugForm() {
		List<String> forms = RxNormDrugForms.longestFirst(List.of("Tablet", "Oral Tablet"));
		assertEquals(List.of("Oral Tablet", "Tablet"), forms);

		assertEquals(Optional.of("Aspirin"), RxNormTermParser.sbdfIngredient("Aspirin Oral Tablet [Bayer]", forms));
		assertEquals(Optional.of("Aspirin Oral"),
				RxNormTermParser.sbdfIngredient("Aspirin Oral Tablet [Bayer]", List.of("Tablet")));
	}

	@Test
	void sbdfWithoutMatchingFormOrBrandIsEmpty() {
		assertTrue(RxNormTermParser.sbdfIngredient("Aspirin Chewing Gum [Bayer]", List.of("Oral Tablet")).isEmpty());
		assertTrue(RxNormTermParser.sbdfIngredient("Aspirin Oral Tablet", List.of("Oral Tablet")).isEmpty());
		assertTrue(RxNormTermParser.sbdfIngredient("Oral Tablet [Bayer]", List.of("Oral Tablet")).isEmpty());
	}
}
