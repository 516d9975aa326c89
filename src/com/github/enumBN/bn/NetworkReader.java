package com.github.enumBN.bn;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.enumBN.utils.Edge;

/**
 * Builds a validated {@link BayesNet} from two text files.
 * <p>
 * The structure file has one edge per line: <br>
 * <code>Rain -> Maintenance<br>
 * Rain -> Train<br></code>
 * <p>
 * The CPT file has one block per node: <br>
 * <code>NODE Train<br>
 * VALUES on_time delayed<br>
 * PARENTS Rain Maintenance<br>
 * TABLE<br>
 * none yes 0.8 0.2<br>
 * ...<br>
 * ENDNODE<br></code>
 * <p>
 * Each table row lists the parent values, in PARENTS order, followed by one
 * probability per value. The PARENTS line is optional: without it the
 * parents are taken from the structure file, in the order their edges
 * appear. In both files empty lines and lines starting with '#' are skipped.
 */
public class NetworkReader {

	private static final Logger logger = LoggerFactory.getLogger(NetworkReader.class);

	private double tolerance = BayesNet.DEFAULT_TOLERANCE;

	private static class Line {
		final int number;
		final String text;

		Line(int number, String text) {
			this.number = number;
			this.text = text;
		}
	}

	private static class NodeBlock {
		String name;
		int lineNumber;
		List<String> values;
		// null when the block has no PARENTS line
		List<String> parents;
		List<Line> rows = new ArrayList<Line>();
	}

	public NetworkReader setTolerance(double tolerance) {
		this.tolerance = tolerance;
		return this;
	}

	public BayesNet read(String structureFileName, String cptFileName) throws IOException, NetworkFormatException {
		logger.info("Loading structure from {}", structureFileName);
		logger.info("Loading CPTs from {}", cptFileName);

		Reader structure = new InputStreamReader(new FileInputStream(structureFileName), StandardCharsets.UTF_8);
		try {
			Reader cpt = new InputStreamReader(new FileInputStream(cptFileName), StandardCharsets.UTF_8);
			try {
				return read(structure, structureFileName, cpt, cptFileName);
			} finally {
				cpt.close();
			}
		} finally {
			structure.close();
		}
	}

	/**
	 * @param structureName
	 *            used in error messages
	 * @param cptName
	 *            used in error messages
	 * @throws NetworkFormatException
	 *             if a file is malformed
	 * @throws StructureException
	 *             if the files are well formed but describe an invalid network
	 */
	public BayesNet read(Reader structure, String structureName, Reader cpt, String cptName) throws IOException,
			NetworkFormatException {

		List<Edge> edges = readEdges(readLines(structure), structureName);
		List<NodeBlock> blocks = readBlocks(readLines(cpt), cptName);

		// parents from the structure file, in order of appearance
		Map<String, List<String>> structureParents = new LinkedHashMap<String, List<String>>();
		for (Edge e : edges) {
			if (!structureParents.containsKey(e.getTail()))
				structureParents.put(e.getTail(), new ArrayList<String>());
			if (!structureParents.containsKey(e.getHead()))
				structureParents.put(e.getHead(), new ArrayList<String>());
			List<String> parents = structureParents.get(e.getHead());
			if (!parents.contains(e.getTail()))
				parents.add(e.getTail());
		}

		Set<String> defined = new HashSet<String>();
		for (NodeBlock block : blocks) {
			defined.add(block.name);
			List<String> fromStructure = structureParents.get(block.name);
			if (block.parents == null) {
				block.parents = fromStructure != null ? fromStructure : new ArrayList<String>();
			} else if (fromStructure != null
					&& !new HashSet<String>(fromStructure).equals(new HashSet<String>(block.parents))) {
				throw new NetworkFormatException(cptName, block.lineNumber, "PARENTS of " + block.name + " "
						+ block.parents + " do not match the structure file " + fromStructure);
			}
		}
		for (String name : structureParents.keySet())
			if (!defined.contains(name))
				throw new NetworkFormatException(cptName, 0, "Node " + name
						+ " appears in the structure file but has no NODE block");

		BayesNet net = new BayesNet(tolerance);
		for (NodeBlock block : blocks)
			net.addNode(block.name, new VariableDomain(block.values), block.parents);
		for (NodeBlock block : blocks)
			net.attachTable(block.name, parseTable(block, cptName));
		net.validate();

		logger.info("Network loaded and validated: {} nodes, order {}", net.size(), net.topologicalOrder());
		return net;
	}

	private static List<Line> readLines(Reader reader) throws IOException {
		BufferedReader br = new BufferedReader(reader);
		List<Line> lines = new ArrayList<Line>();
		String text;
		int number = 0;
		while ((text = br.readLine()) != null) {
			number++;
			text = text.trim();
			// skip empty lines and comments
			if (text.isEmpty() || text.startsWith("#"))
				continue;
			lines.add(new Line(number, text));
		}
		return lines;
	}

	private static List<Edge> readEdges(List<Line> lines, String source) throws NetworkFormatException {
		List<Edge> edges = new ArrayList<Edge>(lines.size());
		for (Line line : lines) {
			int arrow = line.text.indexOf("->");
			if (arrow < 0)
				throw new NetworkFormatException(source, line.number, "Invalid line '" + line.text
						+ "', expected 'Parent -> Child'");
			String tail = line.text.substring(0, arrow).trim();
			String head = line.text.substring(arrow + 2).trim();
			if (tail.isEmpty() || head.isEmpty() || head.contains("->") || hasWhitespace(tail)
					|| hasWhitespace(head))
				throw new NetworkFormatException(source, line.number, "Invalid line '" + line.text
						+ "', expected 'Parent -> Child'");
			if (tail.equals(head))
				throw new NetworkFormatException(source, line.number, "Node " + tail + " cannot be its own parent");
			edges.add(new Edge(tail, head));
		}
		return edges;
	}

	private static boolean hasWhitespace(String s) {
		return s.split("\\s+").length > 1;
	}

	private static List<NodeBlock> readBlocks(List<Line> lines, String source) throws NetworkFormatException {
		List<NodeBlock> blocks = new ArrayList<NodeBlock>();
		int i = 0;
		while (i < lines.size()) {
			Line line = lines.get(i);
			String[] parts = tokens(line);
			if (!parts[0].equals("NODE") || parts.length != 2)
				throw new NetworkFormatException(source, line.number, "Expected 'NODE <name>', found '" + line.text
						+ "'");

			NodeBlock block = new NodeBlock();
			block.name = parts[1];
			block.lineNumber = line.number;
			i++;

			line = expectLine(lines, i, source, "VALUES after NODE " + block.name);
			parts = tokens(line);
			if (!parts[0].equals("VALUES") || parts.length < 2)
				throw new NetworkFormatException(source, line.number, "Expected 'VALUES <v1> <v2> ...' after NODE "
						+ block.name + ", found '" + line.text + "'");
			block.values = Arrays.asList(Arrays.copyOfRange(parts, 1, parts.length));
			if (new LinkedHashSet<String>(block.values).size() != block.values.size())
				throw new NetworkFormatException(source, line.number, "Duplicate values for NODE " + block.name);
			i++;

			line = expectLine(lines, i, source, "TABLE for NODE " + block.name);
			parts = tokens(line);
			if (parts[0].equals("PARENTS")) {
				block.parents = Arrays.asList(Arrays.copyOfRange(parts, 1, parts.length));
				if (block.parents.contains(block.name))
					throw new NetworkFormatException(source, line.number, "NODE " + block.name
							+ " lists itself as a parent");
				if (new HashSet<String>(block.parents).size() != block.parents.size())
					throw new NetworkFormatException(source, line.number, "Duplicate parents for NODE "
							+ block.name + ": " + block.parents);
				i++;
				line = expectLine(lines, i, source, "TABLE for NODE " + block.name);
			}

			if (!line.text.equals("TABLE"))
				throw new NetworkFormatException(source, line.number, "Expected 'TABLE' for NODE " + block.name
						+ ", found '" + line.text + "'");
			i++;

			while (i < lines.size() && !lines.get(i).text.equals("ENDNODE")) {
				block.rows.add(lines.get(i));
				i++;
			}
			if (i >= lines.size())
				throw new NetworkFormatException(source, 0, "Expected 'ENDNODE' for NODE " + block.name
						+ ", found end of file");
			i++;

			blocks.add(block);
		}
		return blocks;
	}

	private static Line expectLine(List<Line> lines, int i, String source, String expected)
			throws NetworkFormatException {
		if (i >= lines.size())
			throw new NetworkFormatException(source, 0, "Expected " + expected + ", found end of file");
		return lines.get(i);
	}

	private static String[] tokens(Line line) {
		return line.text.split("\\s+");
	}

	private static ConditionalTable parseTable(NodeBlock block, String source) throws NetworkFormatException {
		int numParents = block.parents.size();
		int numValues = block.values.size();
		ConditionalTable.Builder builder = new ConditionalTable.Builder();

		for (Line row : block.rows) {
			String[] parts = tokens(row);
			if (parts.length != numParents + numValues)
				throw new NetworkFormatException(source, row.number, "Malformed table line for NODE " + block.name
						+ ": expected " + numParents + " parent values and " + numValues + " probabilities, found '"
						+ row.text + "'");

			List<String> parentValues = Arrays.asList(Arrays.copyOfRange(parts, 0, numParents));
			List<Double> probabilities = new ArrayList<Double>(numValues);
			for (int k = numParents; k < parts.length; k++) {
				try {
					probabilities.add(Double.parseDouble(parts[k]));
				} catch (NumberFormatException e) {
					throw new NetworkFormatException(source, row.number, "Invalid probability '" + parts[k]
							+ "' for NODE " + block.name);
				}
			}

			try {
				builder.addRow(new Configuration(parentValues), probabilities);
			} catch (RowCountMismatchException e) {
				throw new NetworkFormatException(source, row.number, e.getMessage() + " in NODE " + block.name);
			}
		}

		return builder.build();
	}

}
