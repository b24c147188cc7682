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
import java.nio.file.Path;

import org.theranorm.therapy.om.SourceName;

/**
 * Fetches a fresh source artifact into a data directory when none is present.
 * Download, ticket and archive handling live behind this interface.
 */
@FunctionalInterface
public interface SourceRetriever {

	/**
	 * @param source  source to fetch
	 * @param dataDir directory the artifact must be written to, named
	 *                {@code <prefix>_<version>.<ext>}
	 * @return path of the written artifact
	 */
	Path retrieve(SourceName source, Path dataDir) throws IOException;
}
