package com.rapcode.script.flowchart;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import com.rapcode.debug.Debug;
import com.rapcode.script.parser.ErrorKind;
import com.rapcode.script.parser.RapcodeException;

/**
 * Reads a RAPTOR {@code .rap} XML document into a {@link FlowNode} tree.
 *
 * A component is identified by its {@code i:type} attribute ({@code a:Rectangle}) or, failing
 * that, by its element name. Link containers ({@code _Successor}, {@code _left_Child}, ...) either
 * are the component themselves (when typed) or wrap it as their first child element;
 * {@code i:nil="true"} marks an absent link.
 */
public class RaptorXmlReader {
    private static final String TAG = "rapcode.flowchart";
    static final String XSI = "http://www.w3.org/2001/XMLSchema-instance";

    public FlowNode read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            Debug.get().i(TAG, "reading flowchart " + path);
            return read(new InputSource(in));
        } catch (NoSuchFileException e) {
            throw new RapcodeException(ErrorKind.IO, "File not found: " + path, 0, 0, e);
        } catch (IOException e) {
            throw new RapcodeException(ErrorKind.IO, "Cannot read " + path + ": " + e.getMessage(), 0, 0, e);
        }
    }

    public FlowNode readString(String xml) {
        return read(new InputSource(new StringReader(xml)));
    }

    private FlowNode read(InputSource source) {
        Document doc;
        try {
            doc = newBuilder().parse(source);
        } catch (SAXException e) {
            throw new RapcodeException(ErrorKind.LOWERING, "Malformed flowchart XML: " + e.getMessage(), 0, 0, e);
        } catch (IOException e) {
            throw new RapcodeException(ErrorKind.IO, "Cannot read flowchart XML: " + e.getMessage(), 0, 0, e);
        }

        Element start = findStart(doc);
        if (start == null) {
            throw new RapcodeException(ErrorKind.LOWERING, "No <Start> node found in the flowchart.");
        }
        return FlowNode.start(chain(child(start, "_Successor")));
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser configuration failed", e);
        }
    }

    private static Element findStart(Document doc) {
        NodeList all = doc.getElementsByTagNameNS("*", "*");
        for (int i = 0; i < all.getLength(); i++) {
            Element e = (Element) all.item(i);
            if ("Start".equals(localName(e)) || "Start".equals(typeOf(e))) return e;
        }
        return null;
    }

    /**
     * Builds the successor chain starting at {@code container}; null for an absent link.
     * The chain is walked in a loop, so only nesting depth grows the stack.
     */
    private FlowNode chain(Element container) {
        List<Element> elements = new ArrayList<>();
        for (Element e = actualComponent(container); e != null; e = actualComponent(child(e, "_Successor"))) {
            elements.add(e);
        }
        FlowNode next = null;
        for (int i = elements.size() - 1; i >= 0; i--) {
            next = component(elements.get(i), next);
        }
        return next;
    }

    /** Builds the FlowNode for one component element, already linked to its successor. */
    private FlowNode component(Element element, FlowNode successor) {
        String type = typeOf(element);
        String text = text(element);

        switch (type) {
            case "Rectangle":
                return FlowNode.assignment(text, successor);
            case "Parallelogram":
                if (Boolean.parseBoolean(childText(element, "_is_input"))) {
                    return FlowNode.input(text, childText(element, "_prompt"), successor);
                }
                return FlowNode.output(text, successor);
            case "IF_Control":
                return FlowNode.decision(text,
                        chain(child(element, "_left_Child")),
                        chain(child(element, "_right_Child")),
                        successor);
            case "Loop":
                return FlowNode.loop(
                        chain(child(element, "_before_Child")),
                        text,
                        chain(child(element, "_after_Child")),
                        successor);
            case "Oval":
            case "End":
                if (text.toLowerCase(Locale.ROOT).contains("start")) return FlowNode.start(successor);
                return FlowNode.end();
            default:
                return FlowNode.unknown(type, text, successor);
        }
    }

    private static Element actualComponent(Element container) {
        if (container == null || isNil(container)) return null;
        if (container.hasAttributeNS(XSI, "type")) return container;
        for (Node n = container.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element) return isNil((Element) n) ? null : (Element) n;
        }
        return null;
    }

    private static boolean isNil(Element e) {
        return "true".equals(e.getAttributeNS(XSI, "nil"));
    }

    /** Component type from {@code i:type="a:Rectangle"}, else the element's local name. */
    static String typeOf(Element e) {
        String type = e.getAttributeNS(XSI, "type");
        if (type != null && !type.isEmpty()) {
            int colon = type.lastIndexOf(':');
            return colon >= 0 ? type.substring(colon + 1) : type;
        }
        return localName(e);
    }

    private static String localName(Element e) {
        String name = e.getLocalName() != null ? e.getLocalName() : e.getTagName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    /** Direct child element by local name, case-insensitive. */
    private static Element child(Element parent, String name) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element && localName((Element) n).equalsIgnoreCase(name)) {
                return (Element) n;
            }
        }
        return null;
    }

    private static String childText(Element parent, String name) {
        Element c = child(parent, name);
        if (c == null || isNil(c)) return null;
        return c.getTextContent();
    }

    private static String text(Element element) {
        String text = childText(element, "_text_str");
        if (text == null) text = childText(element, "Text");
        return (text == null) ? "" : text.trim();
    }
}
