package strata.frontend;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.LinkedList;
import java.util.List;

/**
* DOM helpers for the XML frontends.
*/
public final class XMLTools {

    private XMLTools() {
    }

    /** Returns the child elements of the node. */
    public static List<Element> getElements(Node node) {
        return getElements(node, null);
    }

    /**
    * Returns the child elements of the node with the given tag name; a null
    * name matches every element.
    */
    public static List<Element> getElements(Node node, String name) {
        List<Element> ret = new LinkedList<Element>();
        if (node == null) {
            return ret;
        }
        NodeList records = node.getChildNodes();
        for (int i = 0; i < records.getLength(); i++) {
            Node record_node = records.item(i);
            if (record_node.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            if (name == null || record_node.getNodeName().equals(name)) {
                ret.add((Element)record_node);
            }
        }
        return ret;
    }

    /** Returns the first child element with the given tag name, or null. */
    public static Element getElement(Node node, String name) {
        List<Element> elements = getElements(node, name);
        return elements.isEmpty() ? null : elements.get(0);
    }

    /** Returns the first child element, or null. */
    public static Element getFirstElement(Node node) {
        List<Element> elements = getElements(node);
        return elements.isEmpty() ? null : elements.get(0);
    }

    /**
    * Returns the element at the end of the given path of tag names, or null.
    */
    public static Element getPath(Node node, String... names) {
        Node ret = node;
        for (String name : names) {
            ret = getElement(ret, name);
            if (ret == null) {
                return null;
            }
        }
        return (Element)ret;
    }

    /** Returns the trimmed text content of the element. */
    public static String getText(Element e) {
        return e.getTextContent().trim();
    }

    /**
    * Returns the value of the attribute, or null if the element has no such
    * attribute.
    */
    public static String getAttribute(Element e, String name) {
        return e.hasAttribute(name) ? e.getAttribute(name) : null;
    }

    /** Checks if the attribute holds <code>true</code>. */
    public static boolean isTrue(Element e, String name) {
        return "true".equalsIgnoreCase(e.getAttribute(name).trim());
    }

    /**
    * Returns the integer value of the attribute, or the default value if
    * the attribute is missing.
    * @throws NumberFormatException if the value is not an integer.
    */
    public static int getInt(Element e, String name, int default_value) {
        String value = getAttribute(e, name);
        if (value == null || value.trim().length() == 0) {
            return default_value;
        }
        return Integer.parseInt(value.trim());
    }

}
