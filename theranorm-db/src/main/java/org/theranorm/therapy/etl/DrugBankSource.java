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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.apache.commons.lang3.StringUtils;
import org.theranorm.therapy.classify.IdentifierClassifier;
import org.theranorm.therapy.om.ApprovalStatus;
import org.theranorm.therapy.om.ConceptRecord;
import org.theranorm.therapy.om.NamespacePrefix;
import org.theranorm.therapy.om.SourceMetadata;
import org.theranorm.therapy.om.SourceMetadata.LicenseAttributes;
import org.theranorm.therapy.om.SourceName;
import org.theranorm.therapy.util.Logger;
import org.theranorm.therapy.util.SourceFiles.SourceFile;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

/**
 * Relationship registry. Walks the DrugBank full-database XML, one
 * {@code <drug>} element per concept.
 */
public class DrugBankSource extends AbstractFileSource<Document> {

	public static final String NS = "http://www.drugbank.ca";

	/** DrugBank external-identifier resource name to namespace. Anything else is dropped. */
	static final Map<String, NamespacePrefix> RESOURCE_PREFIXES;

	static {
		Map<String, NamespacePrefix> m = new LinkedHashMap<>();
		m.put("ChEBI", NamespacePrefix.CHEBI);
		m.put("ChEMBL", NamespacePrefix.CHEMBL);
		m.put("PubChem Compound", NamespacePrefix.PUBCHEMCOMPOUND);
		m.put("PubChem Substance", NamespacePrefix.PUBCHEMSUBSTANCE);
		m.put("KEGG Compound", NamespacePrefix.KEGGCOMPOUND);
		m.put("KEGG Drug", NamespacePrefix.KEGGDRUG);
		m.put("ChemSpider", NamespacePrefix.CHEMSPIDER);
		m.put("BindingDB", NamespacePrefix.BINDINGDB);
		m.put("PharmGKB", NamespacePrefix.PHARMGKB);
		m.put("ZINC", NamespacePrefix.ZINC);
		m.put("RxCUI", NamespacePrefix.RXNORM);
		m.put("PDB", NamespacePrefix.PDB);
		m.put("Therapeutic Targets Database", NamespacePrefix.THERAPEUTICTARGETSDB);
		m.put("IUPHAR", NamespacePrefix.IUPHAR);
		m.put("Guide to Pharmacology", NamespacePrefix.GUIDETOPHARMACOLOGY);
		RESOURCE_PREFIXES = Collections.unmodifiableMap(m);
	}

	public DrugBankSource(Path dataDir, IdentifierClassifier classifier, SourceRetriever retriever) {
		super(dataDir, classifier, retriever);
	}

	@Override
	public SourceName getSourceName() {
		return SourceName.DRUGBANK;
	}

	@Override
	public Document extract() throws SourceUnavailableException {
		SourceFile file = locate("drugbank", "xml");
		try {
			return newDocumentBuilder().parse(file.path().toFile());
		} catch (ParserConfigurationException | SAXException | IOException e) {
			throw new SourceUnavailableException(SourceName.DRUGBANK, "cannot parse " + file.path(), e);
		}
	}

	/** Namespace-aware builder with DTDs and external entities disabled. */
	static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
		DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
		f.setNamespaceAware(true);
		f.setXIncludeAware(false);
		f.setExpandEntityReferences(false);
		f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
		f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
		f.setFeature("http://xml.org/sax/features/external-general-entities", false);
		f.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
		f.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
		return f.newDocumentBuilder();
	}

	@Override
	public TransformResult transform(Document doc) {
		List<ConceptRecord> out = new ArrayList<>();
		int skipped = 0;
		for (Element drug : children(doc.getDocumentElement(), "drug")) {
			try {
				out.add(toRecord(drug));
			} catch (MalformedRecordException e) {
				Logger.warn("DrugBank: {}; skipped", e.getMessage());
				skipped++;
			}
		}
		Logger.info("DrugBank: {} concepts, {} skipped drugs", out.size(), skipped);
		return TransformResult.of(out, skipped);
	}

	ConceptRecord toRecord(Element drug) throws MalformedRecordException {
		String primaryId = null;
		for (Element id : children(drug, "drugbank-id")) {
			if ("true".equals(id.getAttribute("primary")) && StringUtils.isNotBlank(id.getTextContent())) {
				primaryId = id.getTextContent().trim();
				break;
			}
		}
		if (primaryId == null) {
			throw new MalformedRecordException("drug without primary drugbank-id");
		}

		ConceptRecord.Builder b = ConceptRecord.builder(NamespacePrefix.DRUGBANK.curie(primaryId), SourceName.DRUGBANK);
		for (Element el : children(drug, null)) {
			switch (el.getLocalName()) {
			case "drugbank-id":
				if (!el.hasAttribute("primary")) {
					b.alias(text(el));
				}
				break;
			case "name":
				b.label(text(el));
				break;
			case "synonyms":
				for (Element syn : children(el, "synonym")) {
					if ("english".equals(syn.getAttribute("language"))) {
						b.alias(text(syn));
					}
				}
				break;
			case "international-brands":
				for (Element brand : children(el, "international-brand")) {
					b.alias(childText(brand, "name"));
				}
				break;
			case "products":
				loadProducts(el, b);
				break;
			case "external-identifiers":
				loadExternalIdentifiers(el, b);
				break;
			case "cas-number":
				String cas = text(el);
				if (StringUtils.isNotBlank(cas)) {
					addIdentifier(b, NamespacePrefix.CHEMIDPLUS.curie(cas));
				}
				break;
			case "groups":
				b.approvalStatus(approvalStatus(el));
				break;
			default:
				break;
			}
		}
		return b.build();
	}

	/** Products become trade names when generic, approved or over the counter. */
	private static void loadProducts(Element products, ConceptRecord.Builder b) {
		for (Element product : children(products, "product")) {
			if ("true".equals(childText(product, "generic")) || "true".equals(childText(product, "approved"))
					|| "true".equals(childText(product, "over-the-counter"))) {
				b.tradeName(childText(product, "name"));
			}
		}
	}

	private void loadExternalIdentifiers(Element ids, ConceptRecord.Builder b) {
		for (Element ext : children(ids, "external-identifier")) {
			String resource = childText(ext, "resource");
			String identifier = childText(ext, "identifier");
			NamespacePrefix prefix = resource == null ? null : RESOURCE_PREFIXES.get(resource);
			if (prefix == null) {
				Logger.debug("DrugBank: {} ignores resource '{}'", b.getConceptId(), resource);
				continue;
			}
			if (StringUtils.isNotBlank(identifier)) {
				addIdentifier(b, prefix.curie(identifier));
			}
		}
	}

	private void addIdentifier(ConceptRecord.Builder b, String id) {
		b.identifier(id, classifier.classifyIdentifier(id));
	}

	/** First listed of withdrawn, approved, investigational; absent otherwise. */
	static ApprovalStatus approvalStatus(Element groups) {
		List<String> values = new ArrayList<>();
		for (Element g : children(groups, "group")) {
			values.add(text(g));
		}
		if (values.contains("withdrawn")) {
			return ApprovalStatus.WITHDRAWN;
		}
		if (values.contains("approved")) {
			return ApprovalStatus.APPROVED;
		}
		if (values.contains("investigational")) {
			return ApprovalStatus.INVESTIGATIONAL;
		}
		return null;
	}

	@Override
	public SourceMetadata metadata() {
		return new SourceMetadata(SourceName.DRUGBANK, "CC BY-NC 4.0",
				"https://creativecommons.org/licenses/by-nc/4.0/legalcode", getVersion(),
				"https://go.drugbank.com/releases/latest", null, new LicenseAttributes(true, false, true));
	}

	// --- DOM helpers -------------------------------------------------------------

	/** Direct element children in the DrugBank namespace, optionally by local name. */
	private static List<Element> children(Element parent, String localName) {
		List<Element> out = new ArrayList<>();
		if (parent == null) {
			return out;
		}
		for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
			if (n.getNodeType() == Node.ELEMENT_NODE && NS.equals(n.getNamespaceURI())
					&& (localName == null || localName.equals(n.getLocalName()))) {
				out.add((Element) n);
			}
		}
		return out;
	}

	private static String childText(Element parent, String localName) {
		List<Element> els = children(parent, localName);
		return els.isEmpty() ? null : text(els.get(0));
	}

	private static String text(Element el) {
		String t = el.getTextContent();
		return t == null ? null : t.trim();
	}
}
