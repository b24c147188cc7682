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

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.theranorm.therapy.etl.MalformedRecordException;

/** RxNorm dose form names ({@code TTY=DF}), used to peel forms off SBDF terms. */
public final class RxNormDrugForms {

	private RxNormDrugForms() {
	}

	/** One form per line; blanks and repeats dropped. */
	public static List<String> read(Path file) throws IOException {
		Set<String> forms = new LinkedHashSet<>();
		for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
			if (StringUtils.isNotBlank(line)) {
				forms.add(line.trim());
			}
		}
		return new ArrayList<>(forms);
	}

	/** Forms listed in the RRF itself ({@code TTY=DF}, {@code SAB=RXNORM}), first-seen order. */
	public static List<String> harvest(Path rrf) throws IOException {
		Set<String> forms = new LinkedHashSet<>();
		try (Reader in = RrfRow.open(rrf);
				CSVParser parser = RrfRow.FORMAT.parse(in)) {
			for (CSVRecord rec : parser) {
				RrfRow row;
				try {
					row = RrfRow.of(rec);
				} catch (MalformedRecordException e) {
					continue;
				}
				if ("DF".equals(row.tty()) && row.isFrom("RXNORM") && StringUtils.isNotBlank(row.str())) {
					forms.add(row.str());
				}
			}
		}
		return new ArrayList<>(forms);
	}

	/** Longest first; ties keep their input order. */
	public static List<String> longestFirst(Collection<String> forms) {
		List<String> out = new ArrayList<>(forms);
		out.sort(Comparator.comparingInt(String::length).reversed());
		return out;
	}
}
