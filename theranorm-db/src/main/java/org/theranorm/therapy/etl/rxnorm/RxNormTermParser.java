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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * Parsing of RxNorm composite term strings.
 *
 * <p>Grammar of a branded term ({@code SBDC}, {@code SBDF}):</p>
 * <pre>
 *   term       := body '[' brand ']' trailer?
 *   body       := ingredient ( '/' ingredient )*   with strengths and forms mixed in
 *   strength   := digits ( '.' digits )? ' ' ( MG | UNT | ML )? ( '/' ( ML | HR | MG ) )?
 * </pre>
 * The brand is the text of the <b>last</b> bracket group; earlier bracket
 * groups stay part of the body. Strengths are removed from the body only,
 * never from the brand.
 */
public final class RxNormTermParser {

	static final Pattern STRENGTH = Pattern.compile("(\\d*)(\\d*\\.)?\\d+ (MG|UNT|ML)?(/(ML|HR|MG))?");

	private RxNormTermParser() {
	}

	/** Removes every strength/unit match. */
	public static String stripStrength(String term) {
		return term == null ? null : STRENGTH.matcher(term).replaceAll("");
	}

	/** Text of the last {@code [...]} group; empty when the term has none. */
	public static Optional<String> brandOf(String term) {
		if (term == null) {
			return Optional.empty();
		}
		int open = term.lastIndexOf('[');
		if (open < 0) {
			return Optional.empty();
		}
		int close = term.indexOf(']', open + 1);
		if (close < 0) {
			return Optional.empty();
		}
		String brand = term.substring(open + 1, close).trim();
		return brand.isEmpty() ? Optional.empty() : Optional.of(brand);
	}

	/** The term with its last bracket group cut out. */
	static String body(String term) {
		int open = term.lastIndexOf('[');
		if (open < 0) {
			return term;
		}
		int close = term.indexOf(']', open + 1);
		return close < 0 ? term : term.substring(0, open) + term.substring(close + 1);
	}

	/**
	 * Ingredient names of a branded drug component, e.g. {@code Acetaminophen}
	 * and {@code Oxycodone Hydrochloride} from
	 * {@code "Acetaminophen 325 MG / Oxycodone Hydrochloride 5 MG [Percocet]"}.
	 * Empty when the term has no brand.
	 */
	public static List<String> ingredientsOf(String term) {
		if (brandOf(term).isEmpty()) {
			return Collections.emptyList();
		}
		List<String> out = new ArrayList<>();
		for (String part : stripStrength(body(term)).split("/")) {
			String ingredient = StringUtils.normalizeSpace(part);
			if (!ingredient.isEmpty() && !out.contains(ingredient)) {
				out.add(ingredient);
			}
		}
		return out;
	}

	/**
	 * Ingredient of a branded drug form: body with strengths removed and the
	 * first matching drug form cut out. {@code forms} must be ordered longest
	 * first so that {@code Oral Tablet} wins over {@code Tablet}. Empty when
	 * there is no brand, no form matches, or nothing is left.
	 */
	public static Optional<String> sbdfIngredient(String term, List<String> forms) {
		if (brandOf(term).isEmpty()) {
			return Optional.empty();
		}
		String rest = stripStrength(body(term));
		for (String form : forms) {
			if (!form.isEmpty() && rest.contains(form)) {
				String ingredient = StringUtils.normalizeSpace(rest.replace(form, ""));
				return ingredient.isEmpty() ? Optional.empty() : Optional.of(ingredient);
			}
		}
		return Optional.empty();
	}
}
