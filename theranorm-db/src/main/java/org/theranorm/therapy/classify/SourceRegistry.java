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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import org.theranorm.therapy.om.SourceName;

/**
 * Namespaces whose identifiers resolve inside this normalized index. Built
 * from the {@link SourceName} enumeration so that adding a source changes the
 * classification of its namespace everywhere at once.
 */
public final class SourceRegistry {

	private static final SourceRegistry DEFAULT = of(SourceName.values());

	private final Set<String> nativeNamespaces;

	private SourceRegistry(Set<String> nativeNamespaces) {
		this.nativeNamespaces = Collections.unmodifiableSet(nativeNamespaces);
	}

	/** Registry over every {@link SourceName}. */
	public static SourceRegistry fromSources() {
		return DEFAULT;
	}

	public static SourceRegistry of(SourceName... sources) {
		Set<String> ns = new LinkedHashSet<>();
		for (SourceName s : sources) {
			ns.add(s.getPrefix().getValue());
		}
		return new SourceRegistry(ns);
	}

	public static SourceRegistry of(Collection<SourceName> sources) {
		return of(sources.toArray(new SourceName[0]));
	}

	public boolean isNative(String namespace) {
		return namespace != null && nativeNamespaces.contains(namespace.trim().toLowerCase(Locale.ROOT));
	}

	public Set<String> getNativeNamespaces() {
		return nativeNamespaces;
	}
}
