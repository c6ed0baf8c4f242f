package com.team.detection.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.detection.api.TeamDetectionReport;
import com.team.detection.graph.Edge;
import com.team.detection.graph.RelationshipGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the relationship graph as a standalone HTML page driven by the vis-network library.
 * Nodes and edges are embedded as JSON in the page template.
 */
public class GraphHtmlRenderer implements ResultReporter {
    private static final Logger log = LoggerFactory.getLogger(GraphHtmlRenderer.class);

    static final String TEMPLATE_RESOURCE = "/graph-template.html";
    private static final String NODES_PLACEHOLDER = "{{NODES}}";
    private static final String EDGES_PLACEHOLDER = "{{EDGES}}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String template;

    public GraphHtmlRenderer() {
        this.template = loadTemplate();
    }

    @Override
    public void write(TeamDetectionReport report, Writer writer) throws IOException {
        writer.write(render(report.graph()));
        writer.flush();
        log.info("graph.rendered nodes={} edges={}", report.graph().nodeCount(), report.graph().edgeCount());
    }

    String render(RelationshipGraph graph) throws JsonProcessingException {
        List<Map<String, Object>> nodes = graph.getNodes().stream()
                .map(GraphHtmlRenderer::node)
                .toList();
        List<Map<String, Object>> edges = graph.getEdges().stream()
                .map(GraphHtmlRenderer::edge)
                .toList();

        return template
                .replace(NODES_PLACEHOLDER, scriptSafe(objectMapper.writeValueAsString(nodes)))
                .replace(EDGES_PLACEHOLDER, scriptSafe(objectMapper.writeValueAsString(edges)));
    }

    @Override
    public String getFormat() {
        return "html";
    }

    private static Map<String, Object> node(String name) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("id", name);
        node.put("label", name);
        node.put("title", name);
        return node;
    }

    private static Map<String, Object> edge(Edge edge) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("from", edge.first());
        json.put("to", edge.second());
        return json;
    }

    // Display names are user-controlled; keep them from closing the script element
    private static String scriptSafe(String json) {
        return json.replace("</", "<\\/");
    }

    private static String loadTemplate() {
        try (InputStream in = GraphHtmlRenderer.class.getResourceAsStream(TEMPLATE_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing graph template resource " + TEMPLATE_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read graph template", e);
        }
    }
}
