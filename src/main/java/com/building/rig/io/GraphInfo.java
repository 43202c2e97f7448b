package com.building.rig.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;

/**
 * POJO representation of the graph-info document: typed nodes with their
 * neighbour lists and centrality, and weighted edges.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphInfo {
    private List<NodeInfo> nodes = new ArrayList<>();
    private List<EdgeInfo> edges = new ArrayList<>();

    /** One declared node. Field names follow the document's capitalized keys. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({ "ID", "Label", "Type", "Target", "Source", "centrality" })
    public static final class NodeInfo {
        @JsonProperty("ID")
        private String id;
        @JsonProperty("Label")
        private String label;
        @JsonProperty("Type")
        private String type;
        @JsonProperty("Target")
        private List<String> targets = new ArrayList<>();
        @JsonProperty("Source")
        private List<String> sources = new ArrayList<>();
        private double centrality;
    }

    /** One edge; null cost or stealth means the edge carries none. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({ "source", "target", "type", "cost", "stealth" })
    public static final class EdgeInfo {
        private String source, target, type;
        private Double cost, stealth;
    }
}
