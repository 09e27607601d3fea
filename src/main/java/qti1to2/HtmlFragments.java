package qti1to2;

import java.util.regex.Pattern;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Parses the markup held by a text/html mattext. Legacy markup is HTML 4, not XHTML: void
 * tags, unclosed paragraphs and named entities all have to be accepted.
 */
final class HtmlFragments
{
    /** Names that can be written as a plain, unprefixed XML name. */
    private static final Pattern XML_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.-]*");

    private HtmlFragments()
    {
    }

    /**
     * Parses markup as an HTML body fragment and returns the body element that holds it.
     * Scripts and style sheets are removed.
     */
    static Element parse(String markup)
    {
        Element body = Jsoup.parseBodyFragment(markup).body();
        body.select("script,style,noscript,template").remove();
        return body;
    }

    static boolean isElement(Node n)
    {
        return n instanceof Element;
    }

    /** True for nodes with nothing to show: whitespace, comments and doctype remnants. */
    static boolean isBlank(Node n)
    {
        if (n instanceof TextNode)
        {
            return ((TextNode) n).isBlank();
        }
        return !(n instanceof Element);
    }

    /** The lower case tag name of an element node. */
    static String tagName(Node n)
    {
        return ((Element) n).tagName();
    }

    static boolean isXmlName(String name)
    {
        return XML_NAME.matcher(name).matches();
    }
}
