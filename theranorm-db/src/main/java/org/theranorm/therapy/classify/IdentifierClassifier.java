package org.theranorm.therapy.classify;

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

import java.util.Objects;

import org.theranorm.therapy.om.IdentifierKind;
import org.theranorm.therapy.om.NamespacePrefix;
import org.theranorm.therapy.util.Logger;

/**
 * Decides whether a cross-reference is an other identifier (its namespace is
 * loaded by this normalizer) or an xref. Used by every adapter and by the
 * backfill job.
 *
 * <p>Total and side-effect free: any namespace, including an empty or unknown
 * one, yields a kind. Comparison is case-insensitive.</p>
 */
public final class IdentifierClassifier {

	private final SourceRegistry registry;

	public IdentifierClassifier(SourceRegistry registry) {
		this.registry = Objects.requireNonNull(registry, "registry");
	}

	/** Classifier over all sources of the {@code SourceName} enumeration. */
	public static IdentifierClassifier standard() {
		return new IdentifierClassifier(SourceRegistry.fromSources());
	}

	public IdentifierKind classify(String namespace) {
		if (registry.isNative(namespace)) {
			return IdentifierKind.OTHER_IDENTIFIER;
		}
		if (Logger.isEnabled(Logger.Level.DEBUG) && NamespacePrefix.fromValue(namespace) == null) {
			Logger.debug("Unknown identifier namespace '{}', filed as xref", namespace);
		}
		return IdentifierKind.XREF;
	}

	/** Classifies by the text before the first {@code ':'} of {@code identifier}. */
	public IdentifierKind classifyIdentifier(String identifier) {
		return classify(NamespacePrefix.namespaceOf(identifier));
	}

	public SourceRegistry getRegistry() {
		return registry;
	}
}
