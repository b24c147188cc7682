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

import org.theranorm.therapy.om.SourceName;

/**
 * The raw artifact of a source cannot be obtained or opened. Fatal to that
 * source's load only.
 */
public class SourceUnavailableException extends Exception {

	private static final long serialVersionUID = 1L;

	private final SourceName source;

	public SourceUnavailableException(SourceName source, String message) {
		super(source + ": " + message);
		this.source = source;
	}

	public SourceUnavailableException(SourceName source, String message, Throwable cause) {
		super(source + ": " + message, cause);
		this.source = source;
	}

	public SourceName getSource() {
		return source;
	}
}
