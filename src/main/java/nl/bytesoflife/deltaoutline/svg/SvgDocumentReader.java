package nl.bytesoflife.deltaoutline.svg;

import nl.bytesoflife.deltaoutline.model.OutlineSource;
import nl.bytesoflife.deltaoutline.model.PrimitiveShape;
import nl.bytesoflife.deltaoutline.model.ViewBox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts outline content from an SVG document: path data, basic shapes,
 * declared size and viewBox. Styling, transforms and grouping are ignored.
 */
public class SvgDocumentReader {

    private static final Logger log = LoggerFactory.getLogger(SvgDocumentReader.class);

    public static final String SVG_NAMESPACE = "http://www.w3.org/2000/svg";

    static final double DEFAULT_DIMENSION = 100.0;

    // Number followed by an optional unit suffix ("100mm", "50%")
    private static final Pattern LENGTH = Pattern.compile(
            "\\s*([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)\\s*[a-zA-Z%]*\\s*");

    public OutlineSource read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, stem(file));
        }
    }

    public OutlineSource read(String xml, String name) throws IOException {
        return read(new InputSource(new StringReader(xml)), name);
    }

    public OutlineSource read(InputStream in, String name) throws IOException {
        return read(new InputSource(in), name);
    }

    private OutlineSource read(InputSource input, String name) throws IOException {
        Document doc;
        try {
            doc = newDocumentBuilder().parse(input);
        } catch (SAXException e) {
            throw new IOException("Malformed SVG document '" + name + "': " + e.getMessage(), e);
        }

        Element root = doc.getDocumentElement();
        double width = parseDimension(root.getAttribute("width"));
        double height = parseDimension(root.getAttribute("height"));

        ViewBox viewBox = ViewBox.parse(root.getAttribute("viewBox"));
        if (viewBox == null) {
            viewBox = ViewBox.ofSize(width, height);
        }

        List<String> pathData = new ArrayList<>();
        for (Element path : elements(doc, "path")) {
            String d = path.getAttribute("d");
            if (!d.isBlank()) {
                pathData.add(d);
            }
        }

        List<PrimitiveShape> shapes = new ArrayList<>();
        for (Element e : elements(doc, "rect")) {
            shapes.add(new PrimitiveShape.Rect(
                    length(e, "x"), length(e, "y"), length(e, "width"), length(e, "height")));
        }
        for (Element e : elements(doc, "circle")) {
            shapes.add(new PrimitiveShape.Circle(length(e, "cx"), length(e, "cy"), length(e, "r")));
        }
        for (Element e : elements(doc, "ellipse")) {
            shapes.add(new PrimitiveShape.Ellipse(
                    length(e, "cx"), length(e, "cy"), length(e, "rx"), length(e, "ry")));
        }
        for (Element e : elements(doc, "polygon")) {
            shapes.add(new PrimitiveShape.Polygon(e.getAttribute("points")));
        }
        for (Element e : elements(doc, "polyline")) {
            shapes.add(new PrimitiveShape.Polyline(e.getAttribute("points")));
        }

        log.debug("Read SVG '{}': {} path(s), {} shape(s), viewBox {}",
                name, pathData.size(), shapes.size(), viewBox);
        return new OutlineSource(name, pathData, shapes, width, height, viewBox);
    }

    /**
     * Parses a width/height attribute, ignoring unit suffixes ("100mm", "50%").
     * Missing or unparsable values fall back to 100.
     */
    static double parseDimension(String value) {
        Double parsed = parseLength(value);
        return parsed != null ? parsed : DEFAULT_DIMENSION;
    }

    private static double length(Element element, String attribute) {
        String value = element.getAttribute(attribute);
        if (value.isBlank()) return 0;
        Double parsed = parseLength(value);
        if (parsed == null) {
            log.debug("Ignoring unparsable {}=\"{}\" on <{}>", attribute, value, element.getLocalName());
            return 0;
        }
        return parsed;
    }

    static Double parseLength(String value) {
        if (value == null) return null;
        Matcher m = LENGTH.matcher(value);
        return m.matches() ? Double.parseDouble(m.group(1)) : null;
    }

    private static List<Element> elements(Document doc, String localName) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = doc.getElementsByTagNameNS("*", localName);
        for (int i = 0; i < nodes.getLength(); i++) {
            Element e = (Element) nodes.item(i);
            String ns = e.getNamespaceURI();
            if (ns == null || SVG_NAMESPACE.equals(ns)) {
                result.add(e);
            }
        }
        return result;
    }

    private static DocumentBuilder newDocumentBuilder() throws IOException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IOException("XML parser unavailable", e);
        }
    }

    private static String stem(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
