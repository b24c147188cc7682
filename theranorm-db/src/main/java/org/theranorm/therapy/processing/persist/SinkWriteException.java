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

import org.theranorm.therapy.om.ItemKey;

/** One item could not be persisted. Other items of the batch are unaffected. */
public class SinkWriteException extends Exception {

	private static final long serialVersionUID = 1L;

	private final transient ItemKey key;

	public SinkWriteException(ItemKey key, String message, Throwable cause) {
		super(message, cause);
		this.key = key;
	}

	public SinkWriteException(ItemKey key, String message) {
		this(key, message, null);
	}

	/** Key of the failed item; {@code null} for metadata writes. */
	public ItemKey getKey() {
		return key;
	}
}
