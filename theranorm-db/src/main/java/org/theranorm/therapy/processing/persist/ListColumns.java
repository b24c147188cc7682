package org.theranorm.therapy.processing.persist;

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
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Encodes list attributes into one text column as a single CSV line. An
 * absent list is SQL {@code NULL}; an empty list (only found in legacy rows)
 * is the empty string.
 */
final class ListColumns {

	private static final CSVFormat FORMAT = CSVFormat.DEFAULT;

	private ListColumns() {
	}

	static String encode(List<String> values) {
		if (values == null) {
			return null;
		}
		if (values.isEmpty()) {
			return "";
		}
		return FORMAT.format(values.toArray());
	}

	static List<String> decode(String column) {
		if (column == null) {
			return null;
		}
		List<String> out = new ArrayList<>();
		if (column.isEmpty()) {
			return out;
		}
		try (CSVParser parser = FORMAT.parse(new StringReader(column))) {
			for (CSVRecord rec : parser) {
				rec.forEach(out::add);
			}
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		return out;
	}
}
