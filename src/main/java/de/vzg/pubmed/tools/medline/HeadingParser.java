package de.vzg.pubmed.tools.medline;

import java.util.ArrayList;
import java.util.List;

import org.jdom2.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.vzg.pubmed.tools.grounding.Grounder;
import de.vzg.pubmed.tools.model.Heading;
import de.vzg.pubmed.tools.model.Qualifier;
import de.vzg.pubmed.tools.model.Reference;

/**
 * Parses {@code MeshHeading} elements.
 */
public final class HeadingParser {

    private static final Logger log = LoggerFactory.getLogger(HeadingParser.class);

    public static final String MESH_URI_PREFIX = "https://id.nlm.nih.gov/mesh/";

    private static final String MAJOR_TOPIC = "MajorTopicYN";

    private HeadingParser() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * @param headingElement the {@code MeshHeading} element
     * @param meshGrounder resolves a descriptor name without an identifier, may be null
     * @return the heading, or null if there is no {@code DescriptorName}
     * @throws MedlineStructureException if the descriptor has no identifier or a major topic flag is not Y/N
     */
    public static Heading parse(Element headingElement, Grounder meshGrounder) {
        Element descriptor = headingElement.getChild("DescriptorName");
        if (descriptor == null) {
            log.debug("MeshHeading without DescriptorName: {}", MedlineUtils.toCompactXml(headingElement));
            return null;
        }
        String meshId = descriptorId(descriptor, meshGrounder);
        boolean major = MedlineUtils.parseYesNo(descriptor.getAttributeValue(MAJOR_TOPIC), false, MAJOR_TOPIC);

        List<Qualifier> qualifiers = new ArrayList<>();
        for (Element qualifier : headingElement.getChildren("QualifierName")) {
            String qualifierId = qualifier.getAttributeValue("UI");
            if (qualifierId == null || qualifierId.isBlank()) {
                log.warn("QualifierName without UI under descriptor {}, skipping", meshId);
                continue;
            }
            qualifiers.add(new Qualifier(qualifierId.trim(),
                MedlineUtils.parseYesNo(qualifier.getAttributeValue(MAJOR_TOPIC), false, MAJOR_TOPIC)));
        }
        return new Heading(meshId, major, qualifiers.isEmpty() ? null : qualifiers);
    }

    private static String descriptorId(Element descriptor, Grounder meshGrounder) {
        String ui = descriptor.getAttributeValue("UI");
        if (ui != null && !ui.isBlank()) {
            return ui.trim();
        }
        String uri = descriptor.getAttributeValue("URI");
        if (uri != null && !uri.isBlank()) {
            return uri.trim().startsWith(MESH_URI_PREFIX) ? uri.trim().substring(MESH_URI_PREFIX.length()) : uri.trim();
        }
        String name = MedlineUtils.valueOrNull(descriptor);
        if (meshGrounder != null && name != null) {
            String grounded = meshGrounder.resolve(name).map(Reference::identifier).orElse(null);
            if (grounded != null) {
                log.debug("Grounded descriptor '{}' to mesh:{}", name, grounded);
                return grounded;
            }
        }
        throw new MedlineStructureException("Unable to get MeSH ID for descriptor '" + name + "'");
    }
}
