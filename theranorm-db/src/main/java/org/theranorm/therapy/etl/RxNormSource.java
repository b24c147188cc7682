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

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.theranorm.therapy.classify.IdentifierClassifier;
import org.theranorm.therapy.etl.rxnorm.RrfRow;
import org.theranorm.therapy.etl.rxnorm.RxNormDrugForms;
import org.theranorm.therapy.etl.rxnorm.RxNormExtract;
import org.theranorm.therapy.etl.rxnorm.RxNormLinker;
import org.theranorm.therapy.om.SourceMetadata;
import org.theranorm.therapy.om.SourceMetadata.LicenseAttributes;
import org.theranorm.therapy.om.SourceName;
import org.theranorm.therapy.util.Logger;
import org.theranorm.therapy.util.SourceFiles.SourceFile;

/**
 * Terminology graph. Expects {@code rxnorm_<version>.RRF} (the
 * {@code RXNCONSO.RRF} table) and, optionally,
 * {@code rxnorm_drug_forms_<version>.txt}; without the latter, dose forms are
 * harvested from the RRF.
 *
 * <p>This product uses publicly available data courtesy of the U.S. National
 * Library of Medicine (NLM), National Institutes of Health, Department of
 * Health and Human Services; NLM is not responsible for the product and does
 * not endorse or recommend this or any other product.</p>
 */
public class RxNormSource extends AbstractFileSource<RxNormExtract> {

	public RxNormSource(Path dataDir, IdentifierClassifier classifier, SourceRetriever retriever) {
		super(dataDir, classifier, retriever);
	}

	@Override
	public SourceName getSourceName() {
		return SourceName.RXNORM;
	}

	@Override
	public RxNormExtract extract() throws SourceUnavailableException {
		SourceFile rrf = locate("rxnorm", "RRF");
		Path formsFile = dataDir.resolve("rxnorm_drug_forms_" + rrf.version() + ".txt");
		try {
			List<String> forms;
			if (Files.isReadable(formsFile)) {
				forms = RxNormDrugForms.read(formsFile);
			} else {
				Logger.info("RxNorm: {} not found; harvesting dose forms from {}", formsFile.getFileName(),
						rrf.path().getFileName());
				forms = RxNormDrugForms.harvest(rrf.path());
			}
			Logger.info("RxNorm: {} dose forms", forms.size());
			return new RxNormExtract(rrf.path(), forms);
		} catch (IOException e) {
			throw new SourceUnavailableException(SourceName.RXNORM, "cannot read " + rrf.path(), e);
		}
	}

	@Override
	public TransformResult transform(RxNormExtract raw) {
		RxNormLinker linker = new RxNormLinker(classifier, raw.drugForms());
		int malformed = 0;
		long rows = 0;
		try (Reader in = RrfRow.open(raw.rrf());
				CSVParser parser = RrfRow.FORMAT.parse(in)) {
			for (CSVRecord rec : parser) {
				rows++;
				try {
					linker.accept(RrfRow.of(rec));
				} catch (MalformedRecordException e) {
					Logger.warn("RxNorm: {}; skipped", e.getMessage());
					malformed++;
				}
			}
		} catch (IOException e) {
			throw new UncheckedIOException("RxNorm: failed reading " + raw.rrf(), e);
		}
		Logger.info("RxNorm: {} rows read", rows);
		return linker.link(malformed);
	}

	@Override
	public SourceMetadata metadata() {
		return new SourceMetadata(SourceName.RXNORM, "UMLS Metathesaurus",
				"https://www.nlm.nih.gov/research/umls/rxnorm/docs/termsofservice.html", getVersion(),
				"https://www.nlm.nih.gov/research/umls/rxnorm/docs/rxnormfiles.html", null,
				new LicenseAttributes(false, false, true));
	}
}
