package com.github.enumBN.bn;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.enumBN.utils.Utils;

/**
 * A discrete Bayesian network. Nodes are registered with
 * {@link #addNode(String, VariableDomain, List)}, their tables attached with
 * {@link #attachTable(String, ConditionalTable)}, and the whole structure is
 * checked by {@link #validate()}. A validated network is immutable and can be
 * shared by any number of concurrent queries.
 */
public class BayesNet {

	private static final Logger logger = LoggerFactory.getLogger(BayesNet.class);

	/**
	 * Tolerance for CPT rows summing to 1, also used by inference to detect a
	 * zero normalization constant.
	 */
	public static final double DEFAULT_TOLERANCE = 1e-6;

	private final double tolerance;

	// insertion order is kept for printing
	private final Map<String, Node> nodes = new LinkedHashMap<String, Node>();

	// derived on validation
	private Map<String, List<String>> childNodes;

	private List<String> topologicalOrder;

	private boolean validated = false;

	public BayesNet() {
		this(DEFAULT_TOLERANCE);
	}

	public BayesNet(double tolerance) {
		if (!(tolerance >= 0))
			throw new IllegalArgumentException("Tolerance must be non-negative: " + tolerance);
		this.tolerance = tolerance;
	}

	/**
	 * Registers a node. Parents may be registered later; they are checked when
	 * a table is attached and on {@link #validate()}.
	 *
	 * @throws DuplicateNodeException
	 *             if a node with this name already exists
	 */
	public BayesNet addNode(String name, VariableDomain domain, List<String> parents) {
		requireNotValidated();
		if (nodes.containsKey(name))
			throw new DuplicateNodeException(name);
		nodes.put(name, new Node(name, domain, parents));
		return this;
	}

	public BayesNet addNode(String name, VariableDomain domain, String... parents) {
		return addNode(name, domain, Arrays.asList(parents));
	}

	/**
	 * Associates a table with a node, after checking it covers exactly the
	 * parents' domain product and that every row is normalized. On failure
	 * the network is left unchanged.
	 *
	 * @throws UnknownVariableException
	 *             if the node does not exist
	 * @throws UnknownParentException
	 *             if one of its parents was not registered yet
	 * @throws RowCountMismatchException
	 * @throws ProbabilityNormalizationException
	 */
	public BayesNet attachTable(String name, ConditionalTable table) {
		requireNotValidated();
		Node node = nodes.get(name);
		if (node == null)
			throw new UnknownVariableException(name);
		if (node.getTable() != null)
			throw new IllegalStateException("Node " + name + " already has a table");

		table.validate(name, node.getDomain(), parentDomains(node), tolerance);
		node.setTable(table);
		return this;
	}

	private List<VariableDomain> parentDomains(Node node) {
		List<VariableDomain> domains = new ArrayList<VariableDomain>(node.getParents().size());
		for (String parent : node.getParents()) {
			Node p = nodes.get(parent);
			if (p == null)
				throw new UnknownParentException(node.getName(), parent);
			domains.add(p.getDomain());
		}
		return domains;
	}

	/**
	 * Checks the whole network and freezes it: every parent exists, every
	 * node has a table, and the graph is acyclic. Computes the topological
	 * order used by inference.
	 *
	 * @throws UnknownParentException
	 * @throws RowCountMismatchException
	 *             if a node has no table
	 * @throws CycleException
	 */
	public BayesNet validate() {
		requireNotValidated();

		for (Node node : nodes.values()) {
			for (String parent : node.getParents())
				if (!nodes.containsKey(parent))
					throw new UnknownParentException(node.getName(), parent);
			if (node.getTable() == null)
				throw new RowCountMismatchException("Node " + node.getName() + " has no CPT");
		}

		Map<String, List<String>> children = buildChildNodes();
		List<String> order = Utils.topologicalSort(children);

		if (order.size() != nodes.size()) {
			List<String> unordered = new ArrayList<String>(nodes.keySet());
			unordered.removeAll(order);
			Collections.sort(unordered);
			throw new CycleException(unordered);
		}

		this.childNodes = children;
		this.topologicalOrder = Collections.unmodifiableList(order);
		this.validated = true;

		logger.debug("Network validated, {} nodes, topological order {}", nodes.size(), topologicalOrder);
		return this;
	}

	private Map<String, List<String>> buildChildNodes() {
		Map<String, List<String>> children = new LinkedHashMap<String, List<String>>(
				(int) Math.ceil(nodes.size() / 0.75));
		for (String name : nodes.keySet())
			children.put(name, new ArrayList<String>());
		for (Node node : nodes.values())
			for (String parent : node.getParents()) {
				List<String> c = children.get(parent);
				if (c != null)
					c.add(node.getName());
			}
		return children;
	}

	public boolean isValidated() {
		return validated;
	}

	private void requireNotValidated() {
		if (validated)
			throw new IllegalStateException("Network was already validated and cannot be modified");
	}

	private void requireValidated() {
		if (!validated)
			throw new IllegalStateException("Network must be validated first");
	}

	/**
	 * Every node appears after all of its parents; among the nodes that are
	 * ready at any step, the lexicographically smallest goes first.
	 */
	public List<String> topologicalOrder() {
		requireValidated();
		return topologicalOrder;
	}

	/**
	 * @return true if the list holds every node exactly once, each after all
	 *         of its parents
	 */
	public boolean isTopologicalOrder(List<String> order) {
		if (order.size() != nodes.size())
			return false;
		Set<String> seen = new HashSet<String>((int) Math.ceil(order.size() / 0.75));
		for (String name : order) {
			Node node = nodes.get(name);
			if (node == null || seen.contains(name))
				return false;
			for (String parent : node.getParents())
				if (!seen.contains(parent))
					return false;
			seen.add(name);
		}
		return true;
	}

	/**
	 * @return the probability vector of a node given its parents' values,
	 *         aligned with the node's domain
	 * @throws UnknownVariableException
	 * @throws UndefinedRowException
	 */
	public List<Double> lookupCPT(String name, Configuration parentValues) {
		Node node = getNode(name);
		List<Double> row = node.getTable() != null ? node.getTable().get(parentValues) : null;
		if (row == null)
			throw new UndefinedRowException(name, parentValues);
		return row;
	}

	/**
	 * @throws UnknownVariableException
	 */
	public Node getNode(String name) {
		Node node = nodes.get(name);
		if (node == null)
			throw new UnknownVariableException(name);
		return node;
	}

	public boolean containsNode(String name) {
		return nodes.containsKey(name);
	}

	public List<String> getNodeNames() {
		return Collections.unmodifiableList(new ArrayList<String>(nodes.keySet()));
	}

	public int size() {
		return nodes.size();
	}

	public double getTolerance() {
		return tolerance;
	}

	public List<String> roots() {
		List<String> roots = new ArrayList<String>();
		for (Node node : nodes.values())
			if (node.isRoot())
				roots.add(node.getName());
		return roots;
	}

	/**
	 * @return nodes that list the given node as a parent, in registration
	 *         order
	 */
	public List<String> children(String name) {
		getNode(name);
		Map<String, List<String>> children = validated ? childNodes : buildChildNodes();
		return Collections.unmodifiableList(children.get(name));
	}

	private List<String> printingOrder() {
		return validated ? topologicalOrder : new ArrayList<String>(nodes.keySet());
	}

	public String cptsToString() {
		StringBuilder sb = new StringBuilder();
		String ls = System.getProperty("line.separator");

		for (String name : printingOrder()) {
			Node node = nodes.get(name);
			ConditionalTable table = node.getTable();
			VariableDomain domain = node.getDomain();

			sb.append("--- Node: " + name + " ---" + ls);
			sb.append("Values: " + join(domain.getValues(), ", ") + ls);
			if (table == null) {
				sb.append("(no CPT)" + ls + ls);
				continue;
			}

			if (node.isRoot()) {
				List<Double> row = table.get(Configuration.EMPTY);
				for (int k = 0; k < domain.size(); k++)
					sb.append(String.format("  P(%s=%s) = %.4f", name, domain.get(k), row.get(k)) + ls);
			} else {
				sb.append("Parents: " + join(node.getParents(), ", ") + ls);
				String headerParents = join(node.getParents(), " | ");
				String headerValues = join(domain.getValues(), " | ");
				sb.append(headerParents + " || " + headerValues + ls);
				sb.append(repeat('-', headerParents.length() + headerValues.length() + 4) + ls);

				for (Map.Entry<Configuration, List<Double>> entry : table.getRows().entrySet()) {
					List<String> probabilities = new ArrayList<String>(domain.size());
					for (double p : entry.getValue())
						probabilities.add(String.format("%.4f", p));
					sb.append(join(entry.getKey().toList(), " | ") + " || " + join(probabilities, " | ") + ls);
				}
			}
			sb.append(ls);
		}

		return sb.toString();
	}

	public String toDot() {
		StringBuilder sb = new StringBuilder();
		String ls = System.getProperty("line.separator");
		String dl = ls + ls;

		sb.append("digraph bn{" + dl);

		for (String name : printingOrder())
			sb.append("\"" + name + "\"[label=\"" + name + "\"];" + ls);
		sb.append(ls);

		for (String name : printingOrder())
			for (String parent : nodes.get(name).getParents())
				sb.append("\"" + parent + "\" -> \"" + name + "\";" + ls);

		sb.append(ls + "}" + ls);

		return sb.toString();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		String ls = System.getProperty("line.separator");

		List<String> roots = roots();
		sb.append("Root nodes: " + (roots.isEmpty() ? "none" : join(roots, ", ")) + ls + ls);

		Map<String, List<String>> children = validated ? childNodes : buildChildNodes();
		for (String name : printingOrder()) {
			Node node = nodes.get(name);
			List<String> c = children.get(name);
			sb.append("NODE: " + name + ls);
			sb.append("  Parents:  " + (node.isRoot() ? "none" : join(node.getParents(), ", ")) + ls);
			sb.append("  Children: " + (c.isEmpty() ? "none" : join(c, ", ")) + ls);
			sb.append("  Values:   " + join(node.getDomain().getValues(), ", ") + ls + ls);
		}

		return sb.toString();
	}

	private static String join(List<String> values, String separator) {
		return String.join(separator, values);
	}

	private static String repeat(char c, int times) {
		char[] chars = new char[times];
		Arrays.fill(chars, c);
		return new String(chars);
	}

}
