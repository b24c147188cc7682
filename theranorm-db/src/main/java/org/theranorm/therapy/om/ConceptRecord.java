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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

/**
 * Canonical identity record of one therapy concept.
 *
 * <p>Instances are immutable and only produced by {@link Builder#build()},
 * which enforces the record invariants:</p>
 * <ul>
 * <li>{@code concept_id} is namespaced ({@code <prefix>:<local id>});</li>
 * <li>aliases and trade names are de-duplicated by case-folded value and
 * dropped entirely above {@link TermSets#FAN_OUT_CAP} distinct values;</li>
 * <li>other identifiers and xrefs are disjoint; an identifier offered as
 * both stays an other identifier;</li>
 * <li>empty collections mean "absent".</li>
 * </ul>
 */
public final class ConceptRecord {

	private final String conceptId;
	private final SourceName sourceName;
	private final String label;
	private final Set<String> aliases;
	private final Set<String> tradeNames;
	private final Set<String> otherIdentifiers;
	private final Set<String> xrefs;
	private final ApprovalStatus approvalStatus;
	private final Set<ApprovalRating> approvalRatings;

	private ConceptRecord(Builder b) {
		this.conceptId = b.conceptId;
		this.sourceName = b.sourceName;
		this.label = StringUtils.isBlank(b.label) ? null : b.label;
		this.aliases = Collections.unmodifiableSet(TermSets.capped(b.aliases));
		this.tradeNames = Collections.unmodifiableSet(TermSets.capped(b.tradeNames));
		Set<String> others = nonBlank(b.otherIdentifiers);
		Set<String> refs = nonBlank(b.xrefs);
		refs.removeAll(others);
		this.otherIdentifiers = Collections.unmodifiableSet(others);
		this.xrefs = Collections.unmodifiableSet(refs);
		this.approvalStatus = b.approvalStatus;
		this.approvalRatings = b.approvalRatings.isEmpty() ? Collections.emptySet()
				: Collections.unmodifiableSet(EnumSet.copyOf(b.approvalRatings));
	}

	public static Builder builder(String conceptId, SourceName sourceName) {
		return new Builder(conceptId, sourceName);
	}

	public String getConceptId() {
		return conceptId;
	}

	public SourceName getSourceName() {
		return sourceName;
	}

	public Optional<String> getLabel() {
		return Optional.ofNullable(label);
	}

	public Set<String> getAliases() {
		return aliases;
	}

	public Set<String> getTradeNames() {
		return tradeNames;
	}

	public Set<String> getOtherIdentifiers() {
		return otherIdentifiers;
	}

	public Set<String> getXrefs() {
		return xrefs;
	}

	public Optional<ApprovalStatus> getApprovalStatus() {
		return Optional.ofNullable(approvalStatus);
	}

	public Set<ApprovalRating> getApprovalRatings() {
		return approvalRatings;
	}

	/** Index key of the identity record: {@code <lowercased concept id>##identity}. */
	public String identityKey() {
		return ItemType.IDENTITY.key(conceptId);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof ConceptRecord)) return false;
		ConceptRecord that = (ConceptRecord) o;
		return conceptId.equals(that.conceptId) && sourceName == that.sourceName && Objects.equals(label, that.label)
				&& aliases.equals(that.aliases) && tradeNames.equals(that.tradeNames)
				&& otherIdentifiers.equals(that.otherIdentifiers) && xrefs.equals(that.xrefs)
				&& approvalStatus == that.approvalStatus && approvalRatings.equals(that.approvalRatings);
	}

	@Override
	public int hashCode() {
		return Objects.hash(conceptId, sourceName, label, aliases, tradeNames, otherIdentifiers, xrefs,
				approvalStatus, approvalRatings);
	}

	@Override
	public String toString() {
		return "ConceptRecord{" + conceptId + ", src=" + sourceName + ", label=" + label + ", aliases=" + aliases
				+ ", tradeNames=" + tradeNames + ", otherIdentifiers=" + otherIdentifiers + ", xrefs=" + xrefs
				+ ", approvalStatus=" + approvalStatus + ", approvalRatings=" + approvalRatings + "}";
	}

	private static Set<String> nonBlank(Collection<String> values) {
		Set<String> out = new LinkedHashSet<>();
		for (String v : values) {
			if (StringUtils.isNotBlank(v)) {
				out.add(v);
			}
		}
		return out;
	}

	/**
	 * Mutable accumulator used by the adapters while an entity's rows are
	 * being read. Order of first appearance is preserved for every list.
	 */
	public static final class Builder {

		private final String conceptId;
		private final SourceName sourceName;
		private String label;
		private final List<String> aliases = new ArrayList<>();
		private final List<String> tradeNames = new ArrayList<>();
		private final Set<String> otherIdentifiers = new LinkedHashSet<>();
		private final Set<String> xrefs = new LinkedHashSet<>();
		private ApprovalStatus approvalStatus;
		private final Set<ApprovalRating> approvalRatings = EnumSet.noneOf(ApprovalRating.class);

		private Builder(String conceptId, SourceName sourceName) {
			if (StringUtils.isBlank(conceptId) || conceptId.indexOf(':') <= 0) {
				throw new IllegalArgumentException("concept id must be namespaced: " + conceptId);
			}
			this.conceptId = conceptId;
			this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
		}

		public String getConceptId() {
			return conceptId;
		}

		public boolean hasLabel() {
			return StringUtils.isNotBlank(label);
		}

		public String getLabel() {
			return label;
		}

		public Builder label(String label) {
			this.label = label;
			return this;
		}

		/** Adds an alias unless an identical string is already present. */
		public Builder alias(String alias) {
			addIfAbsent(aliases, alias);
			return this;
		}

		public Builder aliases(Collection<String> values) {
			values.forEach(this::alias);
			return this;
		}

		public boolean hasAlias(String alias) {
			return aliases.contains(alias);
		}

		public Builder tradeName(String tradeName) {
			addIfAbsent(tradeNames, tradeName);
			return this;
		}

		public Builder tradeNames(Collection<String> values) {
			values.forEach(this::tradeName);
			return this;
		}

		public List<String> getTradeNames() {
			return Collections.unmodifiableList(tradeNames);
		}

		/**
		 * Files an identifier under the attribute its classification names. The
		 * kind comes from the identifier classifier; nothing else decides it.
		 */
		public Builder identifier(String id, IdentifierKind kind) {
			if (kind == IdentifierKind.OTHER_IDENTIFIER) {
				otherIdentifiers.add(id);
			} else {
				xrefs.add(id);
			}
			return this;
		}

		public Builder approvalStatus(ApprovalStatus status) {
			this.approvalStatus = status;
			return this;
		}

		public Builder approvalRating(ApprovalRating rating) {
			approvalRatings.add(rating);
			return this;
		}

		public ConceptRecord build() {
			return new ConceptRecord(this);
		}

		private static void addIfAbsent(List<String> list, String value) {
			if (StringUtils.isNotBlank(value) && !list.contains(value)) {
				list.add(value);
			}
		}
	}
}
