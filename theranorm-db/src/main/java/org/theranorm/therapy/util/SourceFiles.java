package org.theranorm.therapy.util;

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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Resolves versioned source artifacts named {@code <prefix>_<version>.<ext>}
 * inside a source data directory.
 */
public final class SourceFiles {

	private SourceFiles() {
	}

	/** A resolved artifact and the version parsed from its file name. */
	public record SourceFile(Path path, String version) {
	}

	/**
	 * Newest matching file, by file name order. Empty when the directory is
	 * missing or holds no match.
	 */
	public static Optional<SourceFile> newest(Path dir, String prefix, String extension) throws IOException {
		if (dir == null || !Files.isDirectory(dir)) {
			return Optional.empty();
		}
		try (Stream<Path> files = Files.list(dir)) {
			return files.filter(Files::isRegularFile)
					.filter(p -> versionOf(p, prefix, extension) != null)
					.max(Comparator.comparing(p -> p.getFileName().toString()))
					.map(p -> new SourceFile(p, versionOf(p, prefix, extension)));
		}
	}

	/**
	 * Version token of {@code file}, or {@code null} when its name does not
	 * follow {@code <prefix>_<version>.<ext>}.
	 */
	public static String versionOf(Path file, String prefix, String extension) {
		String name = file.getFileName().toString();
		String head = prefix + "_";
		String tail = "." + extension;
		if (!name.startsWith(head) || !name.endsWith(tail) || name.length() <= head.length() + tail.length()) {
			return null;
		}
		return name.substring(head.length(), name.length() - tail.length());
	}
}
