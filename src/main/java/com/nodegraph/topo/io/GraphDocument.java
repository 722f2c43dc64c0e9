package com.nodegraph.topo.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO representation of a saved graph: a flat list of nodes followed by a
 * flat list of edges. Edges refer to nodes only by id and socket index.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "version", "nodes", "edges" })
public final class GraphDocument {
    public static final String CURRENT_VERSION = "1";

    private String version = CURRENT_VERSION;
    private List<NodeElement> nodes = new ArrayList<>();
    private List<EdgeElement> edges = new ArrayList<>();

    /** Where the document came from (file name or caller tag); not written. */
    @JsonIgnore
    private String source = "memory";

    /** Elements the codec could not map; not written. */
    @JsonIgnore
    private List<RejectedElement> rejected = new ArrayList<>();

    /** A node as stored in the document. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "id", "x", "y", "type", "inputCount", "outputCount" })
    public static final class NodeElement {
        private String id;
        private Double x, y;
        private String type;
        @JsonAlias("inputs")
        private Integer inputCount;
        @JsonAlias("outputs")
        private Integer outputCount;
    }

    /** An edge as stored in the document. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "id", "sourceNodeId", "sourceSocketIndex", "targetNodeId", "targetSocketIndex" })
    public static final class EdgeElement {
        private String id;
        @JsonAlias({ "fromNode", "from" })
        private String sourceNodeId;
        @JsonAlias({ "fromSocketIndex", "from-socket" })
        private Integer sourceSocketIndex;
        @JsonAlias({ "toNode", "to" })
        private String targetNodeId;
        @JsonAlias({ "toSocketIndex", "to-socket" })
        private Integer targetSocketIndex;
    }

    /**
     * An element dropped while reading.
     *
     * @param position zero-based index within its list
     * @param id       the element's id if one could be read, otherwise null
     */
    public record RejectedElement(Section section, int position, String id, String message) {

        public enum Section {
            NODE, EDGE
        }

        /** Id if present, otherwise a positional label such as {@code edges[3]}. */
        public String label() {
            if (id != null)
                return id;
            return (section == Section.NODE ? "nodes[" : "edges[") + position + "]";
        }
    }
}
