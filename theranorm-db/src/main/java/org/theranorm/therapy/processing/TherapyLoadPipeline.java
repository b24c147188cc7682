package org.theranorm.therapy.processing;

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
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.theranorm.therapy.classify.IdentifierClassifier;
import org.theranorm.therapy.conf.ConfigLoader;
import org.theranorm.therapy.etl.SourceRetriever;
import org.theranorm.therapy.etl.SourceUnavailableException;
import org.theranorm.therapy.etl.TherapySource;
import org.theranorm.therapy.etl.TherapySources;
import org.theranorm.therapy.etl.TransformResult;
import org.theranorm.therapy.om.ConceptRecord;
import org.theranorm.therapy.om.LookupRecord;
import org.theranorm.therapy.om.SourceName;
import org.theranorm.therapy.processing.persist.ConceptSink;
import org.theranorm.therapy.processing.persist.IndexWriter;
import org.theranorm.therapy.processing.persist.SinkWriteException;
import org.theranorm.therapy.processing.persist.WriteReport;
import org.theranorm.therapy.util.Logger;

/**
 * Loads sources into the concept index: extract, transform, write and record
 * metadata, one independent task per source on a bounded pool. A source that
 * fails is reported in its {@link LoadSummary}; the others continue.
 */
public class TherapyLoadPipeline {

	private final List<TherapySource<?>> sources;
	private final ConceptSink sink;
	private final int batchSize;
	private final int parallelism;

	public TherapyLoadPipeline(List<? extends TherapySource<?>> sources, ConceptSink sink, int batchSize,
			int parallelism) {
		this.sources = new ArrayList<>(Objects.requireNonNull(sources, "sources"));
		this.sink = Objects.requireNonNull(sink, "sink");
		this.batchSize = batchSize;
		this.parallelism = Math.max(1, parallelism);
	}

	/** Pipeline over the configured {@code SOURCES}. */
	public static TherapyLoadPipeline fromConfig(ConfigLoader cfg, ConceptSink sink, SourceRetriever retriever) {
		IdentifierClassifier classifier = IdentifierClassifier.standard();
		List<TherapySource<?>> sources = new ArrayList<>();
		for (SourceName s : cfg.getSources()) {
			sources.add(TherapySources.create(s, cfg, classifier, retriever));
		}
		return new TherapyLoadPipeline(sources, sink, cfg.getWriteBatchSize(), cfg.getParallelSourceLimit());
	}

	/** Run every source; returns one summary per source, in source order. */
	public Map<SourceName, LoadSummary> run() {
		AtomicInteger seq = new AtomicInteger();
		ExecutorService exec = Executors.newFixedThreadPool(Math.min(parallelism, Math.max(1, sources.size())), r -> {
			Thread t = new Thread(r, "load-" + seq.incrementAndGet());
			t.setDaemon(true);
			return t;
		});

		Map<SourceName, Future<LoadSummary>> futures = new LinkedHashMap<>();
		for (TherapySource<?> src : sources) {
			futures.put(src.getSourceName(), exec.submit(() -> load(src, sink, batchSize)));
		}
		exec.shutdown();

		Map<SourceName, LoadSummary> out = new EnumMap<>(SourceName.class);
		for (Map.Entry<SourceName, Future<LoadSummary>> e : futures.entrySet()) {
			LoadSummary summary;
			try {
				summary = e.getValue().get();
			} catch (InterruptedException ie) {
				Thread.currentThread().interrupt();
				summary = new LoadSummary(e.getKey());
				summary.setFatalError("interrupted");
			} catch (ExecutionException ee) {
				summary = new LoadSummary(e.getKey());
				summary.setFatalError(String.valueOf(ee.getCause()));
			}
			out.put(e.getKey(), summary);
			if (summary.isSuccessful()) {
				Logger.info(summary.describe());
			} else {
				Logger.error(summary.describe());
			}
		}
		return out;
	}

	/** Load one source. Never throws; failures land in the summary. */
	static <R> LoadSummary load(TherapySource<R> src, ConceptSink sink, int batchSize) {
		LoadSummary summary = new LoadSummary(src.getSourceName());
		long start = System.currentTimeMillis();
		Logger.info("{}: load started", src.getSourceName());

		TransformResult result;
		try {
			R raw = src.extract();
			try {
				result = src.transform(raw);
			} finally {
				closeRaw(src.getSourceName(), raw);
			}
		} catch (SourceUnavailableException e) {
			Logger.error("{}: source unavailable: {}", src.getSourceName(), e.getMessage());
			summary.setFatalError(e.getMessage());
			return summary;
		} catch (RuntimeException e) {
			Logger.error("{}: transform failed", e, src.getSourceName());
			summary.setFatalError(e.toString());
			return summary;
		}
		summary.setConcepts(result.concepts().size());
		summary.setSkipped(result.skipped());

		IndexWriter writer = new IndexWriter(sink, batchSize);
		try (writer) {
			for (ConceptRecord r : result.concepts()) {
				writer.add(r);
			}
			for (LookupRecord l : result.extraLookups()) {
				writer.addLookup(l);
			}
		}
		WriteReport report = writer.getReport();
		summary.setWritten(report.getWritten());
		summary.setFailed(report.getFailed());
		summary.setLookupsSkipped(report.getSkipped());

		try {
			sink.putMetadata(src.metadata());
			summary.setMetadataWritten(true);
		} catch (SinkWriteException e) {
			Logger.error("{}: metadata not written: {}", src.getSourceName(), e.getMessage());
		}
		Logger.info("{}: load finished in {} ms", src.getSourceName(), System.currentTimeMillis() - start);
		return summary;
	}

	private static void closeRaw(SourceName source, Object raw) {
		if (raw instanceof AutoCloseable) {
			try {
				((AutoCloseable) raw).close();
			} catch (Exception e) {
				Logger.warn("{}: closing the raw artifact failed: {}", source, e.getMessage());
			}
		}
	}
}
