package com.building.rig.io;

import com.building.rig.api.GraphParseException;
import com.building.rig.api.NodeType;
import com.building.rig.engine.GraphModel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented reader for the DOT text emitted by the rule graph generator.
 *
 * <p>
 * Only two statement shapes matter; everything else (graph header, default
 * attribute statements, closing brace, comments) is skipped:
 * <ul>
 * <li>Node: {@code ID [label="..." ...]}. The id prefix decides the type:
 * {@code CH_} channel, {@code A_} action, {@code T_} trigger, {@code LOGIC_}
 * gate, {@code IMPLICIT_AND_} AND gate. Channel labels tagged
 * {@code [Physical]} or {@code [System]} select the channel subtype; a
 * {@code LOGIC_} id containing {@code AND} is an AND gate, any other is an OR
 * gate.</li>
 * <li>Edge: {@code ID -> ID [...]}.</li>
 * </ul>
 * A line that starts like a node but has no label, or mentions {@code ->} but
 * is not an edge, fails the whole parse.
 */
public final class DotGraphParser {
    private static final Pattern EDGE = Pattern.compile("^\"?([A-Za-z0-9_]+)\"?\\s*->\\s*\"?([A-Za-z0-9_]+)\"?");
    private static final Pattern NODE = Pattern
            .compile("^([A-Za-z0-9_]+)\\s*\\[\\s*label\\s*=\\s*(?:\"([^\"]*)\"|([^\"\\]\\s,]+))");

    private static final String CHANNEL = "CH_";
    private static final String ACTION = "A_";
    private static final String TRIGGER = "T_";
    private static final String LOGIC = "LOGIC_";
    private static final String IMPLICIT_AND = "IMPLICIT_AND_";

    private DotGraphParser() {
        // Utility class
    }

    /** Parses a DOT file; the graph is named after the file. */
    public static GraphModel parseFile(Path path) throws IOException {
        String fileName = path.getFileName().toString();
        String name = fileName.endsWith(".dot") ? fileName.substring(0, fileName.length() - 4) : fileName;
        return parse(Files.readString(path), name);
    }

    public static GraphModel parse(String dot) {
        return parse(dot, "graph");
    }

    public static GraphModel parse(String dot, String graphName) {
        GraphModel.Builder builder = GraphModel.builder(graphName);
        String[] lines = dot.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty() || line.startsWith("//") || line.startsWith("#"))
                continue;

            Matcher edge = EDGE.matcher(line);
            if (edge.lookingAt()) {
                builder.addEdge(edge.group(1), edge.group(2));
                continue;
            }
            if (hasNodePrefix(line)) {
                Matcher node = NODE.matcher(line);
                if (!node.lookingAt())
                    throw new GraphParseException("Malformed node declaration: " + line, i + 1);
                String id = node.group(1);
                String label = node.group(2) != null ? node.group(2) : node.group(3);
                try {
                    builder.addNode(id, label, typeOf(id, label));
                } catch (GraphParseException e) {
                    throw new GraphParseException(e.getMessage(), i + 1);
                }
                continue;
            }
            if (line.contains("->"))
                throw new GraphParseException("Malformed edge: " + line, i + 1);
        }
        return builder.build();
    }

    private static boolean hasNodePrefix(String line) {
        return line.startsWith(CHANNEL) || line.startsWith(ACTION) || line.startsWith(TRIGGER)
                || line.startsWith(LOGIC) || line.startsWith(IMPLICIT_AND);
    }

    static NodeType typeOf(String id, String label) {
        if (id.startsWith(IMPLICIT_AND))
            return NodeType.AND_GATE;
        if (id.startsWith(LOGIC))
            return id.contains("AND") ? NodeType.AND_GATE : NodeType.OR_GATE;
        if (id.startsWith(CHANNEL)) {
            if (label.contains("[Physical]"))
                return NodeType.PHYSICAL_CHANNEL;
            if (label.contains("[System]"))
                return NodeType.SYSTEM_CHANNEL;
            return NodeType.GENERIC_CHANNEL;
        }
        if (id.startsWith(ACTION))
            return NodeType.ACTION;
        return NodeType.TRIGGER;
    }
}
