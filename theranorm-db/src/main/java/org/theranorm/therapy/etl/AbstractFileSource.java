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
import java.util.Objects;
import java.util.Optional;

import org.theranorm.therapy.classify.IdentifierClassifier;
import org.theranorm.therapy.om.SourceName;
import org.theranorm.therapy.util.Logger;
import org.theranorm.therapy.util.SourceFiles;
import org.theranorm.therapy.util.SourceFiles.SourceFile;

/**
 * Base for sources read from a versioned file in their data directory. The
 * newest {@code <prefix>_<version>.<ext>} wins; when none is present the
 * optional {@link SourceRetriever} is asked for one.
 */
public abstract class AbstractFileSource<R> implements TherapySource<R> {

	protected final Path dataDir;
	protected final IdentifierClassifier classifier;
	private final SourceRetriever retriever;

	private SourceFile artifact;

	protected AbstractFileSource(Path dataDir, IdentifierClassifier classifier, SourceRetriever retriever) {
		this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
		this.classifier = Objects.requireNonNull(classifier, "classifier");
		this.retriever = retriever;
	}

	/** Resolve the artifact file, retrieving it when absent. */
	protected SourceFile locate(String prefix, String extension) throws SourceUnavailableException {
		SourceName src = getSourceName();
		try {
			Optional<SourceFile> found = SourceFiles.newest(dataDir, prefix, extension);
			if (found.isEmpty()) {
				if (retriever == null) {
					throw new SourceUnavailableException(src,
							"no " + prefix + "_<version>." + extension + " in " + dataDir + " and no retriever configured");
				}
				Logger.info("No local {} artifact in {}; retrieving", src, dataDir);
				retriever.retrieve(src, dataDir);
				found = SourceFiles.newest(dataDir, prefix, extension);
				if (found.isEmpty()) {
					throw new SourceUnavailableException(src, "retriever produced no artifact in " + dataDir);
				}
			}
			artifact = found.get();
			Logger.info("{}: using {} (version {})", src, artifact.path().getFileName(), artifact.version());
			return artifact;
		} catch (IOException e) {
			throw new SourceUnavailableException(src, "cannot read " + dataDir, e);
		}
	}

	/** Version of the located artifact; {@code null} before {@link #extract()}. */
	public String getVersion() {
		return artifact == null ? null : artifact.version();
	}

	public Path getArtifactPath() {
		return artifact == null ? null : artifact.path();
	}
}
