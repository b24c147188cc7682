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
import java.util.List;

import lombok.Data;

/**
 * Stored row of the concept index. Identity items carry the full attribute
 * set; lookup items only key, concept id, source and type.
 *
 * <p>A {@code null} list means the attribute is absent. Items read back from
 * older loads may also hold empty lists.</p>
 */
@Data
public class IndexItem {

	private String labelAndType;
	private String conceptId;
	private ItemType itemType;
	private String srcName;

	// --- identity attributes ---------------------------------------------------
	private String label;
	private List<String> aliases;
	private List<String> tradeNames;
	private List<String> otherIdentifiers;
	private List<String> xrefs;
	private String approvalStatus;
	private List<String> approvalRatings;

	public ItemKey key() {
		return new ItemKey(labelAndType, conceptId);
	}

	public boolean isIdentity() {
		return itemType == ItemType.IDENTITY;
	}

	public static IndexItem fromConcept(ConceptRecord r) {
		IndexItem item = new IndexItem();
		item.setLabelAndType(r.identityKey());
		item.setConceptId(r.getConceptId());
		item.setItemType(ItemType.IDENTITY);
		item.setSrcName(r.getSourceName().getDisplayName());
		item.setLabel(r.getLabel().orElse(null));
		item.setAliases(listOrNull(r.getAliases()));
		item.setTradeNames(listOrNull(r.getTradeNames()));
		item.setOtherIdentifiers(listOrNull(r.getOtherIdentifiers()));
		item.setXrefs(listOrNull(r.getXrefs()));
		item.setApprovalStatus(r.getApprovalStatus().map(ApprovalStatus::getValue).orElse(null));
		if (!r.getApprovalRatings().isEmpty()) {
			List<String> ratings = new ArrayList<>();
			r.getApprovalRatings().forEach(a -> ratings.add(a.getValue()));
			item.setApprovalRatings(ratings);
		}
		return item;
	}

	public static IndexItem fromLookup(LookupRecord l) {
		IndexItem item = new IndexItem();
		item.setLabelAndType(l.key());
		item.setConceptId(l.conceptId());
		item.setItemType(l.itemType());
		item.setSrcName(l.sourceName().getDisplayName());
		return item;
	}

	/** Deep copy; list attributes are copied, never shared. */
	public IndexItem copy() {
		IndexItem c = new IndexItem();
		c.setLabelAndType(labelAndType);
		c.setConceptId(conceptId);
		c.setItemType(itemType);
		c.setSrcName(srcName);
		c.setLabel(label);
		c.setAliases(copyOf(aliases));
		c.setTradeNames(copyOf(tradeNames));
		c.setOtherIdentifiers(copyOf(otherIdentifiers));
		c.setXrefs(copyOf(xrefs));
		c.setApprovalStatus(approvalStatus);
		c.setApprovalRatings(copyOf(approvalRatings));
		return c;
	}

	private static List<String> listOrNull(java.util.Collection<String> values) {
		return values.isEmpty() ? null : new ArrayList<>(values);
	}

	private static List<String> copyOf(List<String> values) {
		return values == null ? null : new ArrayList<>(values);
	}
}
