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

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

import org.apache.commons.lang3.StringUtils;
import org.theranorm.therapy.classify.IdentifierClassifier;
import org.theranorm.therapy.om.IdentifierKind;
import org.theranorm.therapy.om.IndexItem;
import org.theranorm.therapy.om.SourceName;
import org.theranorm.therapy.processing.persist.ConceptSink;
import org.theranorm.therapy.processing.persist.ItemUpdate;
import org.theranorm.therapy.processing.persist.ScanFilter;
import org.theranorm.therapy.processing.persist.ScanPage;
import org.theranorm.therapy.processing.persist.SinkWriteException;
import org.theranorm.therapy.util.Logger;

/**
 * Re-files the identifiers of stored identity items into other identifiers
 * and xrefs with the same classifier the loaders use.
 *
 * <p>Pages through every identity item not from ChEMBL (whose loader never
 * emits identifiers). For each, the stored other identifiers and xrefs are
 * pooled in that order, de-duplicated and classified again. Lists that change
 * are set; a list that ends up empty is removed rather than stored empty.
 * Nothing is written for an item that is already correct, so a second run is
 * a no-op.</p>
 *
 * <p>The job can resume from the continuation token of the last completed
 * page, handed to the checkpoint listener after each page.</p>
 */
public class XrefBackfillJob {

	private final ConceptSink sink;
	private final IdentifierClassifier classifier;
	private Consumer<String> checkpointListener = token -> {
	};

	public XrefBackfillJob(ConceptSink sink, IdentifierClassifier classifier) {
		this.sink = Objects.requireNonNull(sink, "sink");
		this.classifier = Objects.requireNonNull(classifier, "classifier");
	}

	/** Receives the continuation token of each completed page ({@code null} after the last). */
	public XrefBackfillJob onCheckpoint(Consumer<String> listener) {
		this.checkpointListener = Objects.requireNonNull(listener, "listener");
		return this;
	}

	public BackfillResult run() {
		return run(null);
	}

	/**
	 * @param resumeFrom continuation token to start after, or {@code null} for a full run
	 */
	public BackfillResult run(String resumeFrom) {
		BackfillResult result = new BackfillResult();
		ScanFilter filter = ScanFilter.identitiesExcept(SourceName.CHEMBL.getDisplayName());
		String token = resumeFrom;

		do {
			ScanPage page = sink.scan(filter, token);
			int pageWrites = 0;
			for (IndexItem item : page.items()) {
				result.setScanned(result.getScanned() + 1);
				pageWrites += backfill(item, result);
			}
			token = page.continuation();
			result.setPages(result.getPages() + 1);
			result.setLastContinuation(token);
			Logger.info("Backfill page {}: {} items scanned, {} writes", result.getPages(), page.items().size(),
					pageWrites);
			checkpointListener.accept(token);
		} while (token != null);

		Logger.info("Backfill done: {} scanned, {} updated, {} removals, {} failed", result.getScanned(),
				result.getUpdated(), result.getRemovals(), result.getFailed());
		return result;
	}

	/** Writes the changes of one item; returns the number of writes issued. */
	private int backfill(IndexItem item, BackfillResult result) {
		Map<IdentifierKind, List<String>> derived = reclassify(item);

		Map<IdentifierKind, List<String>> sets = new EnumMap<>(IdentifierKind.class);
		Set<IdentifierKind> removals = EnumSet.noneOf(IdentifierKind.class);
		for (IdentifierKind kind : IdentifierKind.values()) {
			List<String> stored = stored(item, kind);
			List<String> target = derived.get(kind);
			if (target.isEmpty()) {
				if (stored != null) {
					removals.add(kind);
				}
			} else if (!target.equals(stored)) {
				sets.put(kind, target);
			}
		}

		int writes = 0;
		try {
			if (!sets.isEmpty()) {
				sink.update(item.key(), ItemUpdate.set(sets));
				result.setUpdated(result.getUpdated() + 1);
				writes++;
			}
			if (!removals.isEmpty()) {
				sink.update(item.key(), ItemUpdate.remove(removals));
				result.setRemovals(result.getRemovals() + removals.size());
				writes++;
			}
		} catch (SinkWriteException e) {
			result.setFailed(result.getFailed() + 1);
			Logger.warn("Backfill update failed for {}: {}", item.getConceptId(), e.getMessage());
		}
		return writes;
	}

	/** Stored identifiers pooled, de-duplicated and split by kind, first-seen order kept. */
	Map<IdentifierKind, List<String>> reclassify(IndexItem item) {
		Set<String> pooled = new LinkedHashSet<>();
		addAll(pooled, item.getOtherIdentifiers());
		addAll(pooled, item.getXrefs());

		Map<IdentifierKind, List<String>> out = new EnumMap<>(IdentifierKind.class);
		for (IdentifierKind k : IdentifierKind.values()) {
			out.put(k, new ArrayList<>());
		}
		for (String id : pooled) {
			out.get(classifier.classifyIdentifier(id)).add(id);
		}
		return out;
	}

	private static void addAll(Set<String> into, Collection<String> values) {
		if (values == null) {
			return;
		}
		for (String v : values) {
			if (StringUtils.isNotBlank(v)) {
				into.add(v);
			}
		}
	}

	private static List<String> stored(IndexItem item, IdentifierKind kind) {
		return kind == IdentifierKind.OTHER_IDENTIFIER ? item.getOtherIdentifiers() : item.getXrefs();
	}
}
