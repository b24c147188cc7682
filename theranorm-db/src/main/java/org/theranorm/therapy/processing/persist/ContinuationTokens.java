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

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.theranorm.therapy.om.ItemKey;

/** Opaque scan tokens: URL-safe Base64 of the last returned key. */
final class ContinuationTokens {

	private static final char SEP = '\u0001';

	private ContinuationTokens() {
	}

	static String encode(ItemKey last) {
		String raw = last.labelAndType() + SEP + last.conceptId();
		return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
	}

	static ItemKey decode(String token) {
		String raw = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
		int at = raw.indexOf(SEP);
		if (at < 0) {
			throw new IllegalArgumentException("Malformed continuation token");
		}
		return new ItemKey(raw.substring(0, at), raw.substring(at + 1));
	}
}
