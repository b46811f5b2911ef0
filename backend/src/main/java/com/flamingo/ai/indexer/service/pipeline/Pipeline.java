package com.flamingo.ai.indexer.service.pipeline;

import com.flamingo.ai.indexer.exception.PipelineConfigurationException;
import com.flamingo.ai.indexer.service.pipeline.model.PipelinePayload;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * A directed acyclic graph of {@link PipelineComponent}s fed from the implicit {@value #ROOT_NODE}
 * entry point.
 *
 * <p>Inputs are declared as {@code "<Node>"} (any output of that node) or {@code
 * "<Node>.output_<n>"} (only the given channel). A node may only consume nodes added before it, so
 * insertion order is a topological order and cycles cannot be expressed.
 *
 * <p>During {@link #run(PipelinePayload)} each node runs at most once per payload. A node with
 * several inputs takes the first one, in declaration order, that fired; a node none of whose inputs
 * fired is skipped. The graph must have exactly one terminal node.
 *
 * <p>A pipeline belongs to one request: build it, run every file through it, then {@link #close()}
 * it.
 */
@Slf4j
public class Pipeline implements AutoCloseable {

  public static final String ROOT_NODE = "File";

  private static final String EDGE_SEPARATOR = ".";

  private final Map<String, Node> nodes = new LinkedHashMap<>();
  private boolean validated;
  private boolean closed;

  /**
   * Adds a node to the graph.
   *
   * @param component the component to run
   * @param name unique node name
   * @param inputs upstream references, {@value #ROOT_NODE} or earlier nodes
   * @return this pipeline
   * @throws PipelineConfigurationException if the name or an input does not resolve
   */
  public Pipeline addNode(PipelineComponent component, String name, List<String> inputs) {
    ensureOpen();
    if (name == null || name.isBlank() || name.contains(EDGE_SEPARATOR)) {
      throw new PipelineConfigurationException("Invalid node name: '" + name + "'");
    }
    if (ROOT_NODE.equals(name) || nodes.containsKey(name)) {
      throw new PipelineConfigurationException("Node name '" + name + "' is already in use");
    }
    if (inputs == null || inputs.isEmpty()) {
      throw new PipelineConfigurationException("Node '" + name + "' declares no inputs");
    }

    List<Edge> edges = new ArrayList<>();
    for (String input : inputs) {
      edges.add(resolveInput(name, input));
    }
    nodes.put(name, new Node(name, component, List.copyOf(edges)));
    validated = false;
    log.debug("Added node '{}' with inputs {}", name, inputs);
    return this;
  }

  /**
   * Checks the graph has exactly one terminal node.
   *
   * @throws PipelineConfigurationException if the graph is empty or has several sinks
   */
  public void validate() {
    if (nodes.isEmpty()) {
      throw new PipelineConfigurationException("Pipeline has no nodes");
    }
    List<String> terminals = terminalNodes();
    if (terminals.size() != 1) {
      throw new PipelineConfigurationException(
          "Pipeline must have exactly one terminal node, found " + terminals);
    }
    validated = true;
  }

  /**
   * Runs one payload through the graph.
   *
   * @param payload the payload entering at {@value #ROOT_NODE}
   * @return names of the nodes that ran, in execution order
   */
  public List<String> run(PipelinePayload payload) {
    ensureOpen();
    if (!validated) {
      validate();
    }

    Map<String, ComponentOutput> outputs = new HashMap<>();
    List<String> executed = new ArrayList<>();

    for (Node node : nodes.values()) {
      Optional<PipelinePayload> input = firstFiredInput(node, payload, outputs);
      if (input.isEmpty()) {
        log.trace("Skipping node '{}' for {}: no input fired", node.name(), payload.filePath());
        continue;
      }
      executed.add(node.name());
      node.component().run(input.get()).ifPresent(output -> outputs.put(node.name(), output));
    }

    log.debug("File {} passed through {}", payload.filePath(), executed);
    return executed;
  }

  /** Returns node names in insertion order. */
  public List<String> nodeNames() {
    return List.copyOf(nodes.keySet());
  }

  /**
   * Returns the raw input declarations of a node.
   *
   * @param name the node name
   * @return inputs as {@code Node} or {@code Node.output_n}
   */
  public List<String> inputsOf(String name) {
    Node node = nodes.get(name);
    if (node == null) {
      throw new IllegalArgumentException("Unknown node: " + name);
    }
    return node.inputs().stream().map(Edge::toString).toList();
  }

  @Override
  public void close() {
    if (!closed) {
      log.debug("Releasing pipeline with {} node(s)", nodes.size());
      nodes.clear();
      closed = true;
    }
  }

  private Optional<PipelinePayload> firstFiredInput(
      Node node, PipelinePayload rootPayload, Map<String, ComponentOutput> outputs) {
    for (Edge edge : node.inputs()) {
      if (ROOT_NODE.equals(edge.source())) {
        return Optional.of(rootPayload);
      }
      ComponentOutput upstream = outputs.get(edge.source());
      if (upstream != null && (edge.channel() == null || edge.channel().equals(upstream.edge()))) {
        return Optional.of(upstream.payload());
      }
    }
    return Optional.empty();
  }

  private Edge resolveInput(String nodeName, String input) {
    if (input == null || input.isBlank()) {
      throw new PipelineConfigurationException("Node '" + nodeName + "' has a blank input");
    }
    int dot = input.indexOf(EDGE_SEPARATOR);
    String source = dot < 0 ? input : input.substring(0, dot);
    String channel = dot < 0 ? null : input.substring(dot + 1);

    if (ROOT_NODE.equals(source)) {
      if (channel != null) {
        throw new PipelineConfigurationException(
            "Entry point '" + ROOT_NODE + "' has no output channels: " + input);
      }
      return new Edge(source, null);
    }

    Node upstream = nodes.get(source);
    if (upstream == null) {
      throw new PipelineConfigurationException(
          "Input '" + input + "' of node '" + nodeName + "' does not match any earlier node");
    }
    if (channel != null) {
      int outgoing = upstream.component().outgoingEdges();
      boolean known = false;
      for (int i = 1; i <= outgoing; i++) {
        known |= ComponentOutput.edgeName(i).equals(channel);
      }
      if (!known) {
        throw new PipelineConfigurationException(
            "Node '" + source + "' has " + outgoing + " output channel(s), no '" + channel + "'");
      }
    }
    return new Edge(source, channel);
  }

  private List<String> terminalNodes() {
    Set<String> consumed = new HashSet<>();
    for (Node node : nodes.values()) {
      for (Edge edge : node.inputs()) {
        consumed.add(edge.source());
      }
    }
    return nodes.keySet().stream().filter(name -> !consumed.contains(name)).toList();
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Pipeline has been closed");
    }
  }

  private record Node(String name, PipelineComponent component, List<Edge> inputs) {}

  private record Edge(String source, String channel) {

    @Override
    public String toString() {
      return channel == null ? source : source + EDGE_SEPARATOR + channel;
    }
  }
}
