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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;
import org.theranorm.therapy.etl.MalformedRecordException;

/**
 * The columns of an {@code RXNCONSO.RRF} row the linker reads.
 *
 * @param rxcui concept id (column 0)
 * @param sab   source vocabulary (11)
 * @param tty   term type (12)
 * @param code  id in the source vocabulary (13)
 * @param str   term text (14)
 * @param cvf   content view flag (17)
 */
public record RrfRow(String rxcui, String sab, String tty, String code, String str, String cvf) {

	/** Pipe-delimited, unquoted; RRF lines end with a trailing delimiter. */
	public static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
			.setDelimiter('|')
			.setQuote(null)
			.setEscape(null)
			.setIgnoreEmptyLines(true)
			.build();

	static final int MIN_COLUMNS = 18;

	private static final char REPLACEMENT = '\uFFFD';

	/**
	 * Opens an RRF file as UTF-8. Undecodable bytes become U+FFFD instead of
	 * failing the read, so {@link #of(CSVRecord)} can reject just that row.
	 */
	public static Reader open(Path rrf) throws IOException {
		return new BufferedReader(new InputStreamReader(Files.newInputStream(rrf),
				StandardCharsets.UTF_8.newDecoder()
						.onMalformedInput(CodingErrorAction.REPLACE)
						.onUnmappableCharacter(CodingErrorAction.REPLACE)));
	}

	public static RrfRow of(CSVRecord rec) throws MalformedRecordException {
		if (rec.size() < MIN_COLUMNS) {
			throw new MalformedRecordException("RRF line " + rec.getRecordNumber() + " has " + rec.size() + " columns");
		}
		for (String value : rec) {
			if (value.indexOf(REPLACEMENT) >= 0) {
				throw new MalformedRecordException("RRF line " + rec.getRecordNumber() + " has undecodable bytes");
			}
		}
		return new RrfRow(rec.get(0), rec.get(11), rec.get(12), rec.get(13), rec.get(14), rec.get(17));
	}

	public boolean isFrom(String vocabulary) {
		return vocabulary.equals(sab);
	}
}
