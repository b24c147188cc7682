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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.theranorm.therapy.classify.IdentifierClassifier;
import org.theranorm.therapy.etl.TransformResult;
import org.theranorm.therapy.om.ApprovalRating;
import org.theranorm.therapy.om.ConceptRecord;
import org.theranorm.therapy.om.LookupRecord;
import org.theranorm.therapy.om.NamespacePrefix;
import org.theranorm.therapy.om.SourceName;
import org.theranorm.therapy.om.TermSets;
import org.theranorm.therapy.util.Logger;

/**
 * Builds RxNorm ingredient concepts and their brand links from the unordered
 * rows of {@code RXNCONSO.RRF}.
 *
 * <p><b>Pass 1</b> ({@link #accept(RrfRow)}, once per row): fills the concept
 * drafts and the link tables.</p>
 * <ul>
 * <li>{@code BN} rows of RXNORM record brand text to concept id;</li>
 * <li>{@code SBDC} rows of RXNORM map each ingredient to the bracketed brand
 * and create no concept;</li>
 * <li>every other row adds label, alias, trade name or cross-reference to its
 * concept; {@code SBDF} rows of RXNORM also map their ingredient to the
 * brand;</li>
 * <li>MeSH {@code MH} rows give a concept its synonym id, MeSH {@code PEP}
 * rows list precise ingredient names under that id.</li>
 * </ul>
 *
 * <p><b>Pass 2</b> ({@link #link(int)}, once): concepts without a label are
 * dropped; every other concept gains the brands of its label and of its
 * precise ingredient names as trade names, and one {@code rx_brand} lookup per
 * trade name that is itself a brand concept.</p>
 *
 * <p>All tables belong to this instance and are released by {@link #link(int)};
 * use one linker per transform.</p>
 */
public final class RxNormLinker {

	/** Vocabularies whose rows are read; others are ignored. */
	static final Set<String> SAB_ALLOW_LIST = Set.of("ATC", "CVX", "DRUGBANK", "MMSL", "MSH", "MTHCMSFRF", "MTHSPL",
			"RXNORM", "USP", "VANDF");

	// designated alias/syn, tall man, permutation, generic, preferred, entry term, clinical drug
	static final Set<String> ALIAS_TTYS = Set.of("SYN", "SY", "TMSY", "PM", "GN", "PT", "PEP", "CD", "ET", "RXN_PT");

	// brand names and semantic branded drug
	static final Set<String> TRADE_NAME_TTYS = Set.of("BD", "BN", "SBD");

	static final String RXNORM = "RXNORM";
	static final String MSH = "MSH";
	static final String CVF_PRESCRIBABLE = "4096";
	static final String NOCODE = "NOCODE";

	private final IdentifierClassifier classifier;
	private final List<String> drugForms;

	private final Map<String, Draft> drafts = new LinkedHashMap<>();
	private final Map<String, Set<String>> ingredientBrands = new HashMap<>();
	private final Map<String, Set<String>> ingredientFormBrands = new HashMap<>();
	private final Map<String, String> brandConcepts = new HashMap<>();
	private final Map<String, List<String>> preciseIngredients = new HashMap<>();

	private int unparsable;
	private boolean linked;

	public RxNormLinker(IdentifierClassifier classifier, List<String> drugForms) {
		this.classifier = classifier;
		this.drugForms = RxNormDrugForms.longestFirst(drugForms);
	}

	/** Concept draft: builder plus the transient MeSH synonym id. */
	private static final class Draft {
		final ConceptRecord.Builder builder;
		String synonymId;

		Draft(String conceptId) {
			this.builder = ConceptRecord.builder(conceptId, SourceName.RXNORM);
		}
	}

	// ---------------------------------------------------------------------------
	// Pass 1
	// ---------------------------------------------------------------------------

	public void accept(RrfRow row) {
		if (linked) {
			throw new IllegalStateException("linker already linked");
		}
		if (!SAB_ALLOW_LIST.contains(row.sab()) || StringUtils.isBlank(row.rxcui())) {
			return;
		}
		String conceptId = NamespacePrefix.RXNORM.curie(row.rxcui());

		if ("BN".equals(row.tty()) && row.isFrom(RXNORM)) {
			brandConcepts.put(row.str(), conceptId);
		}
		if ("SBDC".equals(row.tty()) && row.isFrom(RXNORM)) {
			linkComponent(row);
			return;
		}

		Draft d = drafts.computeIfAbsent(conceptId, Draft::new);
		addTerm(d, row);
		addCrossReference(d, row);
	}

	private void linkComponent(RrfRow row) {
		Optional<String> brand = RxNormTermParser.brandOf(row.str());
		if (brand.isEmpty()) {
			Logger.warn("RxNorm: SBDC '{}' (rxcui {}) has no brand; skipped", row.str(), row.rxcui());
			unparsable++;
			return;
		}
		for (String ingredient : RxNormTermParser.ingredientsOf(row.str())) {
			ingredientBrands.computeIfAbsent(TermSets.fold(ingredient), k -> new LinkedHashSet<>()).add(brand.get());
		}
	}

	private void addTerm(Draft d, RrfRow row) {
		String tty = row.tty();
		String term = row.str();

		if (("IN".equals(tty) || "PIN".equals(tty)) && row.isFrom(RXNORM)) {
			d.builder.label(term);
			if (CVF_PRESCRIBABLE.equals(row.cvf())) {
				d.builder.approvalRating(ApprovalRating.RXNORM_PRESCRIBABLE);
			}
		} else if (ALIAS_TTYS.contains(tty)) {
			d.builder.alias(term);
		} else if (TRADE_NAME_TTYS.contains(tty)) {
			d.builder.tradeName(term);
		}

		if (row.isFrom(RXNORM)) {
			if ("SBDF".equals(tty)) {
				linkForm(row);
			}
		} else if (row.isFrom(MSH)) {
			if ("MH".equals(tty)) {
				d.synonymId = row.code();
			} else if ("PEP".equals(tty)) {
				List<String> names = preciseIngredients.computeIfAbsent(row.code(), k -> new ArrayList<>());
				if (!names.contains(term)) {
					names.add(term);
				}
			}
		}
	}

	private void linkForm(RrfRow row) {
		Optional<String> brand = RxNormTermParser.brandOf(row.str());
		if (brand.isEmpty()) {
			Logger.warn("RxNorm: SBDF '{}' (rxcui {}) has no brand; skipped", row.str(), row.rxcui());
			unparsable++;
			return;
		}
		Optional<String> ingredient = RxNormTermParser.sbdfIngredient(row.str(), drugForms);
		if (ingredient.isEmpty()) {
			Logger.debug("RxNorm: no drug form in SBDF '{}'", row.str());
			return;
		}
		ingredientFormBrands.computeIfAbsent(TermSets.fold(ingredient.get()), k -> new LinkedHashSet<>())
				.add(brand.get());
	}

	/** Cross-reference from the row's own vocabulary code; self references are dropped. */
	private void addCrossReference(Draft d, RrfRow row) {
		String code = row.code();
		if (StringUtils.isBlank(code) || NOCODE.equals(code)) {
			return;
		}
		NamespacePrefix ns = "MTHSPL".equals(row.sab()) ? NamespacePrefix.UNII : NamespacePrefix.valueOf(row.sab());
		String id = ns.curie(code);
		if (id.equalsIgnoreCase(d.builder.getConceptId())) {
			return;
		}
		d.builder.identifier(id, classifier.classifyIdentifier(id));
	}

	// ---------------------------------------------------------------------------
	// Pass 2
	// ---------------------------------------------------------------------------

	/**
	 * Resolve trade names and brand links, then release the tables.
	 *
	 * @param malformedRows rows the caller could not read, added to the skipped count
	 */
	public TransformResult link(int malformedRows) {
		if (linked) {
			throw new IllegalStateException("linker already linked");
		}
		linked = true;

		List<ConceptRecord> concepts = new ArrayList<>();
		List<LookupRecord> brandLinks = new ArrayList<>();
		int unlabeled = 0;

		for (Draft d : drafts.values()) {
			if (!d.builder.hasLabel()) {
				unlabeled++;
				continue;
			}
			addTradeNames(d);
			ConceptRecord record = d.builder.build();
			concepts.add(record);

			for (String tradeName : record.getTradeNames()) {
				String brandConcept = brandConcepts.get(tradeName);
				if (brandConcept != null) {
					brandLinks.add(LookupRecord.brand(brandConcept, record.getConceptId()));
				}
			}
		}
		Logger.info("RxNorm: {} concepts, {} brand links, {} unlabeled concepts dropped", concepts.size(),
				brandLinks.size(), unlabeled);

		drafts.clear();
		ingredientBrands.clear();
		ingredientFormBrands.clear();
		brandConcepts.clear();
		preciseIngredients.clear();

		return new TransformResult(concepts, brandLinks, malformedRows + unparsable);
	}

	private void addTradeNames(Draft d) {
		String label = d.builder.getLabel();
		List<String> candidates = new ArrayList<>();
		candidates.add(label);
		if (d.synonymId != null) {
			candidates.addAll(preciseIngredients.getOrDefault(d.synonymId, Collections.emptyList()));
		}
		for (String candidate : candidates) {
			d.builder.tradeNames(ingredientBrands.getOrDefault(TermSets.fold(candidate), Collections.emptySet()));
		}
		d.builder.tradeNames(ingredientFormBrands.getOrDefault(TermSets.fold(label), Collections.emptySet()));
	}
}
