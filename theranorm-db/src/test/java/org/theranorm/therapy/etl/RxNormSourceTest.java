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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.theranorm.therapy.classify.IdentifierClassifier;
import org.theranorm.therapy.etl.rxnorm.RxNormExtract;
import org.theranorm.therapy.om.ConceptRecord;
import org.theranorm.therapy.om.SourceMetadata;
import org.theranorm.therapy.om.SourceName;

class RxNormSourceTest {

	@TempDir
	Path dataDir;

	/** One RXNCONSO line: 18 columns plus the trailing delimiter. */
	private static String rrf(String rxcui, String sab, String tty, String code, String str, String cvf) {
		String[] cols = new String[18];
		java.util.Arrays.fill(cols, "");
		cols[0] = rxcui;
		cols[1] = "ENG";
		cols[11] = sab;
		cols[12] = tty;
		cols[13] = code;
		cols[14] = str;
		cols[16] = "N";
		cols[17] = cvf;
		return String.join("|", cols) + "|";
	}

	private RxNormSource source() {
		return new RxNormSource(dataDir, IdentifierClassifier.standard(), null);
	}

	@Test
	void loadsConceptsAndHarvestsFormsWhenNoFormsFile() throws Exception {
		Files.write(dataDir.resolve("rxnorm_20250106.RRF"), List.of(
				rrf("1", "RXNORM", "IN", "1", "Ibuprofen", "4096"),
				rrf("317541", "RXNORM", "DF", "317541", "Oral Tablet", ""),
				rrf("8", "RXNORM", "BN", "8", "Advil", ""),
				rrf("7", "RXNORM", "SBDF", "7", "Ibuprofen Oral Tablet [Advil]", ""),
				"1|ENG|truncated"), StandardCharsets.UTF_8);

		RxNormSource src = source();
		RxNormExtract raw = src.extract();
		assertEquals(List.of("Oral Tablet"), raw.drugForms());
		assertEquals("20250106", src.getVersion());

		TransformResult result = src.transform(raw);
		assertEquals(1, result.concepts().size());
		ConceptRecord ibuprofen = result.concepts().get(0);
		assertEquals("rxcui:1", ibuprofen.getConceptId());
		assertEquals(Set.of("Advil"), ibuprofen.getTradeNames());
		assertEquals(1, result.extraLookups().size());
		assertEquals(1, result.skipped(), "truncated line");

		SourceMetadata md = src.metadata();
		assertEquals(SourceName.RXNORM, md.getSourceName());
		assertEquals("20250106", md.getVersion());
	}

	@Test
	void formsFileTakesPrecedence() throws Exception {
		Files.write(dataDir.resolve("rxnorm_20250106.RRF"), List.of(
				rrf("317541", "RXNORM", "DF", "317541", "Oral Tablet", "")), StandardCharsets.UTF_8);
		Files.write(dataDir.resolve("rxnorm_drug_forms_20250106.txt"), List.of("Chewable Tablet", "", "Injection"),
				StandardCharsets.UTF_8);

		assertEquals(List.of("Chewable Tablet", "Injection"), source().extract().drugForms());
	}

	@Test
	void newestArtifactWins() throws Exception {
		Files.write(dataDir.resolve("rxnorm_20240101.RRF"), List.of(), StandardCharsets.UTF_8);
		Files.write(dataDir.resolve("rxnorm_20250106.RRF"), List.of(), StandardCharsets.UTF_8);

		RxNormSource src = source();
		src.extract();
		assertEquals("20250106", src.getVersion());
	}

	@Test
	void missingArtifactWithoutRetrieverIsUnavailable() {
		SourceUnavailableException e = assertThrows(SourceUnavailableException.class, () -> source().extract());
		assertEquals(SourceName.RXNORM, e.getSource());
	}

	@Test
	void retrieverIsAskedWhenArtifactIsMissing() throws Exception {
		SourceRetriever retriever = (name, dir) -> {
			Path p = dir.resolve("rxnorm_20250201.RRF");
			Files.write(p, List.of(rrf("1", "RXNORM", "IN", "1", "Aspirin", "")), StandardCharsets.UTF_8);
			return p;
		};
		RxNormSource src = new RxNormSource(dataDir, IdentifierClassifier.standard(), retriever);
		TransformResult result = src.transform(src.extract());
		assertEquals("20250201", src.getVersion());
		assertEquals(1, result.concepts().size());
	}

	@Test
	void undecodableRow_isSkipped_andNeighboursLoad() throws Exception {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		bytes.write((rrf("1", "RXNORM", "IN", "1", "Aspirin", "") + "\n").getBytes(StandardCharsets.UTF_8));
		String[] bad = rrf("2", "RXNORM", "IN", "2", "Xmarker", "").split("Xmarker");
		bytes.write(bad[0].getBytes(StandardCharsets.UTF_8));
		bytes.write(new byte[] { 'X', (byte) 0xC3, (byte) 0x28 });
		bytes.write((bad[1] + "\n").getBytes(StandardCharsets.UTF_8));
		bytes.write((rrf("3", "RXNORM", "IN", "3", "Ibuprofen", "") + "\n").getBytes(StandardCharsets.UTF_8));
		Files.write(dataDir.resolve("rxnorm_20250106.RRF"), bytes.toByteArray());

		RxNormSource src = source();
		TransformResult result = src.transform(src.extract());
		assertEquals(2, result.concepts().size());
		assertEquals(Set.of("Aspirin", "Ibuprofen"),
				result.concepts().stream().map(c -> c.getLabel().get()).collect(Collectors.toSet()));
		assertEquals(1, result.skipped());
	}
}
