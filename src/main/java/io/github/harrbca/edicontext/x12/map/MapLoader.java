package io.github.harrbca.edicontext.x12.map;

import io.github.harrbca.edicontext.x12.X12StructureException;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Slf4j
public class MapLoader {

    private static final String CLASSPATH_PREFIX = "classpath:";

    @Getter
    private final String mapPath;
    private final ConcurrentMap<String, X12Map> cache = new ConcurrentHashMap<>();

    public MapLoader(@NonNull String mapPath) {
        this.mapPath = mapPath;
    }

    public X12Map load(@NonNull String mapFile) {
        return cache.computeIfAbsent(mapFile, this::parse);
    }

    InputStream open(String file) throws IOException {
        return openResource(mapPath, file);
    }

    static InputStream openResource(String mapPath, String file) throws IOException {
        if (mapPath.startsWith(CLASSPATH_PREFIX)) {
            String dir = mapPath.substring(CLASSPATH_PREFIX.length());
            String resource = (dir.isEmpty() || dir.endsWith("/") ? dir : dir + "/") + file;
            InputStream in = MapLoader.class.getClassLoader().getResourceAsStream(resource.startsWith("/") ? resource.substring(1) : resource);
            if (in == null) {
                throw new X12StructureException("Map file not found on classpath: " + resource);
            }
            return in;
        }
        Path path = Paths.get(mapPath).resolve(file);
        if (!Files.isReadable(path)) {
            throw new X12StructureException("Map file not found: " + path);
        }
        return Files.newInputStream(path);
    }

    static Document readXml(InputStream in) throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setIgnoringComments(true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(in);
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Invalid map XML", e);
        }
    }

    private X12Map parse(String mapFile) {
        log.info("Loading map {} from {}", mapFile, mapPath);
        try (InputStream in = open(mapFile)) {
            Element transaction = readXml(in).getDocumentElement();
            MapNode root = MapNode.builder()
                    .type(NodeType.MAP_ROOT)
                    .id(transaction.getAttribute("xid"))
                    .name(childText(transaction, "name"))
                    .build();
            for (Element child : childElements(transaction)) {
                if ("loop".equals(child.getTagName())) {
                    parseLoop(child, root);
                }
            }
            return new X12Map(mapFile, root.getId(), root.getName(), root);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load map " + mapFile, e);
        }
    }

    private void parseLoop(Element el, MapNode parent) {
        MapNode loop = MapNode.builder()
                .type(NodeType.LOOP)
                .id(el.getAttribute("xid"))
                .name(childText(el, "name"))
                .usage(childText(el, "usage"))
                .position(parseInt(childText(el, "pos")))
                .maxUse(parseRepeat(childText(el, "repeat")))
                .parent(parent)
                .build();
        for (Element child : childElements(el)) {
            switch (child.getTagName()) {
                case "loop" -> parseLoop(child, loop);
                case "segment" -> parseSegment(child, loop);
                default -> {
                    // loop attributes already read
                }
            }
        }
    }

    private void parseSegment(Element el, MapNode parent) {
        MapNode segment = MapNode.builder()
                .type(NodeType.SEGMENT)
                .id(el.getAttribute("xid"))
                .name(childText(el, "name"))
                .usage(childText(el, "usage"))
                .position(parseInt(childText(el, "pos")))
                .maxUse(parseRepeat(childText(el, "max_use")))
                .parent(parent)
                .build();
        for (Element child : childElements(el)) {
            switch (child.getTagName()) {
                case "element" -> parseElement(child, segment);
                case "composite" -> parseComposite(child, segment);
                default -> {
                    // segment attributes already read
                }
            }
        }
    }

    private void parseComposite(Element el, MapNode parent) {
        MapNode composite = MapNode.builder()
                .type(NodeType.COMPOSITE)
                .id(el.getAttribute("xid"))
                .name(childText(el, "name"))
                .usage(childText(el, "usage"))
                .position(parseInt(childText(el, "seq")))
                .maxUse(1)
                .parent(parent)
                .build();
        for (Element child : childElements(el)) {
            if ("element".equals(child.getTagName())) {
                parseElement(child, composite);
            }
        }
    }

    private void parseElement(Element el, MapNode parent) {
        Set<String> codes = new LinkedHashSet<>();
        Element validCodes = firstChild(el, "valid_codes");
        if (validCodes != null) {
            for (Element code : childElements(validCodes)) {
                codes.add(code.getTextContent().trim());
            }
        }
        MapNode.builder()
                .type(NodeType.ELEMENT)
                .id(el.getAttribute("xid"))
                .name(childText(el, "name"))
                .usage(childText(el, "usage"))
                .position(parseInt(childText(el, "seq")))
                .maxUse(1)
                .dataType(childText(el, "data_type"))
                .validCodes(codes)
                .parent(parent)
                .build();
    }

    // --- Helpers ---

    private static Iterable<Element> childElements(Element parent) {
        NodeList nodes = parent.getChildNodes();
        List<Element> elements = new ArrayList<>();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) node);
            }
        }
        return elements;
    }

    private static Element firstChild(Element parent, String tag) {
        for (Element child : childElements(parent)) {
            if (tag.equals(child.getTagName())) return child;
        }
        return null;
    }

    static String childText(Element parent, String tag) {
        Element child = firstChild(parent, tag);
        return child == null ? null : child.getTextContent().trim();
    }

    private static int parseInt(String value) {
        if (value == null || value.isBlank()) return 0;
        return Integer.parseInt(value.trim());
    }

    private static int parseRepeat(String value) {
        if (value == null || value.isBlank()) return 1;
        if (value.startsWith(">")) return MapNode.UNBOUNDED;
        return Integer.parseInt(value.trim());
    }
}
