package com.nodegraph.topo.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.nodegraph.topo.io.GraphDocument.EdgeElement;
import com.nodegraph.topo.io.GraphDocument.NodeElement;
import com.nodegraph.topo.io.GraphDocument.RejectedElement;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Reads and writes {@link GraphDocument}s as JSON.
 *
 * <p>
 * Reading is lenient per element: the document is parsed into a tree first,
 * then every node and edge element is mapped on its own. An element that
 * cannot be mapped is recorded in {@link GraphDocument#getRejected()} and the
 * rest of the document still loads. Only a document that is not JSON at all,
 * or whose root or lists have the wrong shape, fails the whole read.
 *
 * <p>
 * Writing always uses the current property names.
 */
@Log4j2
public final class DocumentCodec {
    private final ObjectMapper mapper;

    public DocumentCodec() {
        this(new ObjectMapper());
    }

    public DocumentCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
    }

    public GraphDocument read(Path path) throws IOException {
        JsonNode root = mapper.readTree(path.toFile());
        return fromTree(root, path.getFileName().toString());
    }

    public GraphDocument read(String json) throws IOException {
        return read(json, "memory");
    }

    public GraphDocument read(String json, String source) throws IOException {
        return fromTree(mapper.readTree(json), source);
    }

    /**
     * Writes the document, replacing the file atomically where the file system
     * allows it.
     */
    public void write(GraphDocument document, Path path) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null)
            Files.createDirectories(dir);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), document);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Wrote {} nodes, {} edges to {}", document.getNodes().size(), document.getEdges().size(), path);
    }

    public String writeString(GraphDocument document) throws JsonProcessingException {
        return mapper.writeValueAsString(document);
    }

    private GraphDocument fromTree(JsonNode root, String source) throws IOException {
        if (root == null || !root.isObject())
            throw new IOException("Document " + source + " is not a JSON object");

        GraphDocument document = new GraphDocument();
        document.setSource(source);

        JsonNode version = root.get("version");
        if (version != null && !version.isNull()) {
            document.setVersion(version.asText());
            if (!GraphDocument.CURRENT_VERSION.equals(version.asText()))
                log.warn("Document {} has version {}, reading as {}", source, version.asText(),
                        GraphDocument.CURRENT_VERSION);
        }

        JsonNode nodes = list(root, "nodes", source);
        for (int i = 0; i < nodes.size(); i++) {
            NodeElement element = map(nodes.get(i), NodeElement.class, RejectedElement.Section.NODE, i, document);
            if (element != null)
                document.getNodes().add(element);
        }
        JsonNode edges = list(root, "edges", source);
        for (int i = 0; i < edges.size(); i++) {
            EdgeElement element = map(edges.get(i), EdgeElement.class, RejectedElement.Section.EDGE, i, document);
            if (element != null)
                document.getEdges().add(element);
        }

        List<RejectedElement> rejected = document.getRejected();
        if (!rejected.isEmpty())
            log.warn("Document {}: {} elements could not be mapped", source, rejected.size());
        return document;
    }

    private static JsonNode list(JsonNode root, String field, String source) throws IOException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull())
            return JsonNodeFactory.instance.arrayNode();
        if (!node.isArray())
            throw new IOException("Document " + source + ": '" + field + "' must be an array");
        return node;
    }

    private <T> T map(JsonNode element, Class<T> type, RejectedElement.Section section, int position,
            GraphDocument document) {
        String id = element.path("id").isValueNode() ? element.path("id").asText() : null;
        if (!element.isObject()) {
            document.getRejected().add(new RejectedElement(section, position, null, "Element is not an object"));
            return null;
        }
        try {
            return mapper.treeToValue(element, type);
        } catch (JsonProcessingException e) {
            document.getRejected().add(new RejectedElement(section, position, id, e.getOriginalMessage()));
            return null;
        }
    }
}
