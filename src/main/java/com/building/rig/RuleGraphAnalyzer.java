package com.building.rig;

import com.building.rig.engine.ForestBuilder;
import com.building.rig.engine.GraphModel;
import com.building.rig.engine.PathEnumerator;
import com.building.rig.engine.TreeSplitter;
import com.building.rig.io.DotGraphParser;
import com.building.rig.io.GraphInfoMapper;
import com.building.rig.io.ScoreReportWriter;
import com.building.rig.score.PathScore;
import com.building.rig.score.PathScorer;
import com.building.rig.tree.PathForest;
import com.building.rig.tree.PathStructure;
import com.building.rig.tree.PathTree;
import com.building.rig.util.PathExplain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A high-level wrapper that runs the whole path analysis for a target node.
 * <p>
 * This class handles:
 * <ul>
 * <li>Loading a graph from DOT text or a graph-info document</li>
 * <li>Reverse path search with {@link PathEnumerator}</li>
 * <li>Merging branches with {@link ForestBuilder} and splitting them at OR
 * points with {@link TreeSplitter}</li>
 * <li>Converting trees to {@link PathStructure}s and scoring them with
 * {@link PathScorer}</li>
 * <li>Writing the score CSV, the path-forest text and the graph-info
 * document</li>
 * </ul>
 * A target that is not in the graph yields empty results and a warning.
 */
public class RuleGraphAnalyzer {
    private static final Logger log = LogManager.getLogger(RuleGraphAnalyzer.class);

    private final GraphModel graph;
    private final PathEnumerator enumerator;
    private final ForestBuilder forestBuilder = new ForestBuilder();
    private final TreeSplitter splitter;
    private final PathScorer scorer;

    public RuleGraphAnalyzer(GraphModel graph) {
        this.graph = graph;
        this.enumerator = new PathEnumerator(graph);
        this.splitter = new TreeSplitter(graph);
        this.scorer = new PathScorer(graph);
        log.info("Graph {} loaded: {} nodes, {} edges", graph.name(), graph.nodeCount(), graph.edgeCount());
    }

    /** Loads a graph from a DOT file produced by the rule graph generator. */
    public static RuleGraphAnalyzer fromDot(Path dotFile) {
        try {
            return new RuleGraphAnalyzer(DotGraphParser.parseFile(dotFile));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load graph from " + dotFile, e);
        }
    }

    /** Loads a graph from a graph-info JSON document. */
    public static RuleGraphAnalyzer fromGraphInfo(Path jsonFile) {
        try {
            return new RuleGraphAnalyzer(GraphInfoMapper.read(jsonFile));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load graph from " + jsonFile, e);
        }
    }

    public GraphModel getGraph() {
        return graph;
    }

    /** Raw branches to the target, each from first cause to target. */
    public List<List<String>> findPaths(String target) {
        return enumerator.findPaths(target);
    }

    /** Independent path trees rooted at the target. */
    public List<PathTree> pathTrees(String target) {
        List<List<String>> branches = enumerator.findBackwardPaths(target);
        if (branches.isEmpty())
            return List.of();
        PathForest forest = forestBuilder.buildForest(branches);
        return splitter.splitAll(forest);
    }

    /** One nested structure per independent path tree, in causal order. */
    public List<PathStructure> pathStructures(String target) {
        List<PathTree> trees = pathTrees(target);
        List<PathStructure> structures = new ArrayList<>(trees.size());
        for (PathTree t : trees)
            structures.add(PathStructure.fromTree(t));
        return structures;
    }

    public List<PathScore> scorePaths(String target) {
        List<PathStructure> structures = pathStructures(target);
        if (log.isDebugEnabled()) {
            PathExplain explain = new PathExplain(graph);
            for (int i = 0; i < structures.size(); i++)
                log.debug("Path {}: {}\n{}", i + 1, structures.get(i), explain.explainHops(structures.get(i)));
        }
        return scorer.analyzeAll(structures);
    }

    /**
     * Scores every path to the target and writes them as CSV into
     * {@code outputDir}.
     *
     * @return the written file.
     */
    public Path writeScoreReport(String target, Path outputDir) {
        List<PathScore> scores = scorePaths(target);
        Path file = outputDir.resolve(ScoreReportWriter.defaultFileName(target, graph.name()));
        try {
            Files.createDirectories(outputDir);
            ScoreReportWriter.write(scores, file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write score report " + file, e);
        }
        log.info("Path score analysis results written to: {}", file);
        return file;
    }

    /**
     * Writes the independent path trees for the target as indented text into
     * {@code outputDir}.
     *
     * @return the written file.
     */
    public Path writePathForest(String target, Path outputDir) {
        List<PathTree> trees = pathTrees(target);
        Path file = outputDir.resolve("PathsForest_Split_for_" + target + "_from_" + graph.name() + ".txt");
        try {
            Files.createDirectories(outputDir);
            Files.writeString(file, new PathExplain(graph).renderTrees(target, trees));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write path forest " + file, e);
        }
        log.info("Path forest successfully saved to: {}", file);
        return file;
    }

    /** Writes the graph-info document for the loaded graph. */
    public void writeGraphInfo(Path file) {
        try {
            GraphInfoMapper.write(graph, file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write graph info " + file, e);
        }
        log.info("Node and edge information written to: {}", file);
    }
}
