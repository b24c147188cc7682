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

import org.theranorm.therapy.classify.IdentifierClassifier;
import org.theranorm.therapy.conf.ConfigLoader;
import org.theranorm.therapy.om.SourceName;

/** Creates the adapter of a source from configuration. */
public final class TherapySources {

	private TherapySources() {
	}

	/**
	 * @param retriever fetches missing artifacts; may be {@code null}
	 * @throws IllegalArgumentException for a source without a loader
	 */
	public static TherapySource<?> create(SourceName source, ConfigLoader cfg, IdentifierClassifier classifier,
			SourceRetriever retriever) {
		switch (source) {
		case CHEMBL:
			return ChemblSource.fromConfig(cfg);
		case DRUGBANK:
			return new DrugBankSource(cfg.getSourceDataDir(source), classifier, retriever);
		case RXNORM:
			return new RxNormSource(cfg.getSourceDataDir(source), classifier, retriever);
		case WIKIDATA:
			return new WikidataSource(cfg.getSourceDataDir(source), classifier, retriever);
		default:
			throw new IllegalArgumentException("No loader for " + source);
		}
	}
}
