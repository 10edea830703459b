package domlocator.locator;

import org.jsoup.helper.W3CDom;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.NodeList;

import java.util.List;
import java.util.Objects;

/**
 * {@link UniquenessOracle} over a jsoup {@link Document}.
 *
 * <p>CSS goes through jsoup's selector engine. XPath goes through the JDK
 * XPath 1.0 engine on a W3C DOM copy of the document; the copy is built on
 * the first XPath query and reused for the rest of the pass, so the oracle
 * must not outlive the snapshot it was created for.
 *
 * <p>Not thread-safe. Create one per analysis pass.
 */
public class JsoupOracle implements UniquenessOracle {

    private static final Logger log = LoggerFactory.getLogger(JsoupOracle.class);

    private final Document document;

    private W3CDom w3c;
    private org.w3c.dom.Node w3cContext;
    private long cssQueries;
    private long xpathQueries;

    public JsoupOracle(Document document) {
        this.document = Objects.requireNonNull(document, "document");
    }

    @Override
    public List<Element> select(String css) {
        cssQueries++;
        try {
            return document.select(css);
        } catch (RuntimeException e) {
            throw new OracleQueryException(css, e);
        }
    }

    @Override
    public List<Element> selectXpath(String xpath) {
        xpathQueries++;
        try {
            NodeList nodes = w3cDom().selectXpath(xpath, w3cContext);
            return w3c.sourceNodes(nodes, Element.class);
        } catch (RuntimeException e) {
            throw new OracleQueryException(xpath, e);
        }
    }

    /** Number of queries evaluated so far, both syntaxes. */
    public long queryCount() {
        return cssQueries + xpathQueries;
    }

    public Document getDocument() {
        return document;
    }

    private W3CDom w3cDom() {
        if (w3c == null) {
            W3CDom converter = new W3CDom().namespaceAware(false);
            org.w3c.dom.Document converted = converter.fromJsoup(document);
            w3cContext = converter.contextNode(converted);
            w3c = converter;
            log.debug("Converted document to W3C DOM for XPath evaluation");
        }
        return w3c;
    }
}
