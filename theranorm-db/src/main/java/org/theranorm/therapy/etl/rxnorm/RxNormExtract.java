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

import java.nio.file.Path;
import java.util.List;

/**
 * Raw RxNorm artifact: the concept-names file and the drug-form list.
 *
 * @param rrf       {@code rxnorm_<version>.RRF}
 * @param drugForms dose form names, any order
 */
public record RxNormExtract(Path rrf, List<String> drugForms) {

	public RxNormExtract {
		drugForms = List.copyOf(drugForms);
	}
}
