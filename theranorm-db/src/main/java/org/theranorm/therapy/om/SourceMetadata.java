package org.theranorm.therapy.om;

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

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Provenance of one source load: license, version and download location.
 * One record per source, replaced on every load.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourceMetadata {

	private SourceName sourceName;
	private String dataLicense;
	private String dataLicenseUrl;
	private String version;
	private String dataUrl;
	/** Reusable Data Project assessment, when one exists. */
	private String rdpUrl;
	private LicenseAttributes licenseAttributes;

	/** License flags as published by the source. */
	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	public static class LicenseAttributes {
		private boolean nonCommercial;
		private boolean shareAlike;
		private boolean attribution;
	}
}
