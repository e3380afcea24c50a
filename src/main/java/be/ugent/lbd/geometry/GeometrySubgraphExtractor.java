/*
 * 
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *     http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package be.ugent.lbd.geometry;

import be.ugent.lbd.model.Entity;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.graph.Triple;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.riot.out.NodeFmtLib;
import org.apache.jena.riot.system.PrefixMap;
import org.apache.jena.riot.system.PrefixMapFactory;
import org.apache.jena.sparql.graph.GraphFactory;
import org.apache.jena.vocabulary.DCTerms;
import org.apache.jena.vocabulary.RDF;
import org.apache.jena.vocabulary.RDFS;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Index over the Turtle produced by a geometry kernel. Every
 * {@code geo:Feature} subject is filed under the IFC GUID encoded in its local
 * name, {@code <prefix>_<hex>_..._<hex>_<suffix>}. A lookup replays the
 * subgraph below each feature of a GUID, breadth first, with the feature
 * itself renamed to a caller supplied label.
 * <p>
 * The graph is not modified after construction; lookups may run concurrently.
 */
public class GeometrySubgraphExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(GeometrySubgraphExtractor.class);

    public static final String GEO_NS = "http://www.opengis.net/ont/geosparql#";
    public static final String WKT_LITERAL = GEO_NS + "wktLiteral";
    public static final int DEFAULT_NODE_CEILING = 1_000_000;

    // computed by the kernel's serializer, not part of the model
    private static final String DERIVED_MARKER = "body_footprint_geometry";

    private static final Pattern SAFE_LOCAL_NAME = Pattern.compile("[A-Za-z0-9_]([A-Za-z0-9_.\\-]*[A-Za-z0-9_\\-])?");

    private static final Set<Node> SKIPPED_PREDICATES = Set.of(RDFS.label.asNode(), DCTerms.identifier.asNode());

    private final Graph graph;
    private final Map<String, List<Node>> featuresByGuid;
    private final int nodeCeiling;

    public GeometrySubgraphExtractor(Graph graph) {
        this(graph, DEFAULT_NODE_CEILING);
    }

    public GeometrySubgraphExtractor(Graph graph, int nodeCeiling) {
        this.graph = graph;
        this.nodeCeiling = nodeCeiling;
        this.featuresByGuid = index(graph);
    }

    /**
     * Parses a Turtle buffer into an in-memory graph and indexes it.
     */
    public static GeometrySubgraphExtractor fromTurtle(String turtle) {
        Graph graph = GraphFactory.createGraphMem();
        RDFDataMgr.read(graph, new StringReader(turtle), null, Lang.TURTLE);
        LOG.info("Parsed geometry buffer: {} triples", graph.size());
        return new GeometrySubgraphExtractor(graph);
    }

    public Set<String> getGuids() {
        return Collections.unmodifiableSet(featuresByGuid.keySet());
    }

    public int getFeatureCount() {
        int count = 0;
        for (List<Node> features : featuresByGuid.values()) {
            count += features.size();
        }
        return count;
    }

    /**
     * @param prefixes prefix to namespace IRI, in the order they are tried
     */
    public Iterator<SubgraphTriple> lookup(String guid, String label, Map<String, String> prefixes) {
        List<Node> features = featuresByGuid.get(guid);
        if (features == null) {
            return Collections.emptyIterator();
        }
        return new SubgraphIterator(features, label, new Renderer(prefixes));
    }

    public Iterator<SubgraphTriple> lookup(Entity entity, String label, Map<String, String> prefixes) {
        return entity.getGlobalId()
                        .map(guid -> lookup(guid, label, prefixes))
                        .orElse(Collections.emptyIterator());
    }

    public GeometryLookup asLookup(Map<String, String> prefixes) {
        Map<String, String> copy = new LinkedHashMap<>(prefixes);
        return (entity, label) -> lookup(entity, label, copy);
    }

    private static Map<String, List<Node>> index(Graph graph) {
        Map<String, List<Node>> result = new HashMap<>();
        Node feature = NodeFactory.createURI(GEO_NS + "Feature");
        List<Triple> typed = graph.find(Node.ANY, RDF.type.asNode(), feature).toList();
        for (Triple t : typed) {
            Node subject = t.getSubject();
            if (!subject.isURI()) {
                continue;
            }
            String guid = guidOf(subject.getURI());
            if (guid == null) {
                LOG.warn("Cannot derive a GUID from feature {}", subject.getURI());
                continue;
            }
            result.computeIfAbsent(guid, k -> new ArrayList<>()).add(subject);
        }
        for (List<Node> features : result.values()) {
            features.sort(Comparator.comparing(Node::getURI));
        }
        LOG.debug("Indexed {} features under {} GUIDs", typed.size(), result.size());
        return result;
    }

    /**
     * @return the compressed GUID encoded in a feature IRI, or null
     */
    static String guidOf(String uri) {
        String localName = uri.substring(uri.lastIndexOf('/') + 1);
        String[] parts = localName.split("_", -1);
        if (parts.length < 3) {
            return null;
        }
        StringBuilder hex = new StringBuilder();
        for (int i = 1; i < parts.length - 1; i++) {
            hex.append(parts[i]);
        }
        try {
            return IfcGuid.compress(hex.toString());
        } catch (IllegalArgumentException e) {
            LOG.debug("Not a GUID: {}", e.getMessage());
            return null;
        }
    }

    private static boolean isDerived(Node node) {
        String text;
        if (node.isURI()) {
            text = node.getURI();
        } else if (node.isLiteral()) {
            text = node.getLiteralLexicalForm();
        } else {
            text = node.getBlankNodeLabel();
        }
        return text.contains(DERIVED_MARKER);
    }

    private static Node roundWkt(Node node) {
        if (node.isLiteral() && WKT_LITERAL.equals(node.getLiteralDatatypeURI())) {
            return NodeFactory.createLiteral(WktLiterals.round(node.getLiteralLexicalForm()),
                            node.getLiteralDatatype());
        }
        return node;
    }

    /**
     * Turns nodes into Turtle terms.
     */
    private static final class Renderer {
        private final Map<String, String> prefixes;
        private final PrefixMap prefixMap;

        private Renderer(Map<String, String> prefixes) {
            this.prefixes = prefixes;
            this.prefixMap = PrefixMapFactory.create(prefixes);
        }

        String render(Node node) {
            if (node.isURI()) {
                String uri = node.getURI();
                if (RDF.type.getURI().equals(uri)) {
                    return "a";
                }
                for (Map.Entry<String, String> entry : prefixes.entrySet()) {
                    String ns = entry.getValue();
                    if (uri.startsWith(ns)) {
                        String local = uri.substring(ns.length());
                        if (local.isEmpty() || SAFE_LOCAL_NAME.matcher(local).matches()) {
                            return entry.getKey() + ":" + local;
                        }
                    }
                }
                return "<" + uri + ">";
            }
            return NodeFmtLib.str(node, prefixMap);
        }
    }

    /**
     * Lazy breadth-first walk below every feature of one GUID. Each feature
     * has its own visited set.
     */
    private final class SubgraphIterator implements Iterator<SubgraphTriple> {
        private final Iterator<Node> roots;
        private final String label;
        private final Renderer renderer;

        private Node root;
        private Deque<Node> queue = new ArrayDeque<>();
        private Set<Node> visited = new HashSet<>();
        private boolean truncated;
        private Node current;
        private Iterator<Triple> pending = Collections.emptyIterator();
        private SubgraphTriple next;

        private SubgraphIterator(List<Node> roots, String label, Renderer renderer) {
            this.roots = roots.iterator();
            this.label = label;
            this.renderer = renderer;
        }

        @Override
        public boolean hasNext() {
            while (next == null) {
                if (pending.hasNext()) {
                    next = accept(pending.next());
                } else if (!queue.isEmpty()) {
                    current = queue.poll();
                    pending = graph.find(current, Node.ANY, Node.ANY).toList().iterator();
                } else if (roots.hasNext()) {
                    root = roots.next();
                    queue = new ArrayDeque<>();
                    visited = new HashSet<>();
                    truncated = false;
                    visited.add(root);
                    queue.add(root);
                } else {
                    return false;
                }
            }
            return true;
        }

        @Override
        public SubgraphTriple next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            SubgraphTriple result = next;
            next = null;
            return result;
        }

        private SubgraphTriple accept(Triple t) {
            Node predicate = t.getPredicate();
            Node object = t.getObject();
            if (SKIPPED_PREDICATES.contains(predicate) || isDerived(object)) {
                return null;
            }
            if ((object.isURI() || object.isBlank()) && !visited.contains(object)) {
                if (visited.size() < nodeCeiling) {
                    visited.add(object);
                    queue.add(object);
                } else if (!truncated) {
                    truncated = true;
                    LOG.warn("Geometry subgraph of {} truncated at {} nodes", root, nodeCeiling);
                }
            }
            String subject = current.equals(root) ? label : renderer.render(current);
            return new SubgraphTriple(subject, renderer.render(predicate), renderer.render(roundWkt(object)));
        }
    }
}
