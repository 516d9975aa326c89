package com.github.enumBN.cli;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionBuilder;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import au.com.bytecode.opencsv.CSVWriter;

import com.github.enumBN.bn.BayesNet;
import com.github.enumBN.bn.BayesNetException;
import com.github.enumBN.bn.Distribution;
import com.github.enumBN.bn.EnumerationInference;
import com.github.enumBN.bn.MemoizedEnumerationInference;
import com.github.enumBN.bn.NetworkFormatException;
import com.github.enumBN.bn.NetworkReader;
import com.github.enumBN.bn.PrintStreamTraceListener;

public class Query {

	private static final Logger logger = LoggerFactory.getLogger(Query.class);

	public static void main(String[] args) {
		int status = run(args, System.out, System.err);
		if (status != 0)
			System.exit(status);
	}

	@SuppressWarnings({ "static-access" })
	private static Options createOptions() {

		// create Options object
		Options options = new Options();

		Option structureFile = OptionBuilder.withArgName("file").hasArg().isRequired()
				.withDescription("Network structure file, one 'Parent -> Child' edge per line.")
				.withLongOpt("structureFile").create("s");

		Option cptFile = OptionBuilder.withArgName("file").hasArg().isRequired()
				.withDescription("Conditional probability tables file, one NODE ... ENDNODE block per node.")
				.withLongOpt("cptFile").create("c");

		Option query = OptionBuilder.withArgName("node").hasArg().isRequired()
				.withDescription("Variable whose posterior distribution is computed.").withLongOpt("query")
				.create("q");

		Option evidence = OptionBuilder.withArgName("node=value,...").hasArgs().withValueSeparator(',')
				.withDescription("Observed values. May be given several times.").withLongOpt("evidence")
				.create("e");

		Option verbose = OptionBuilder.withDescription("Prints a trace of the enumeration.")
				.withLongOpt("verbose").create("v");

		Option memoize = OptionBuilder
				.withDescription("Caches repeated sub-enumerations. Same result, faster on larger networks.")
				.withLongOpt("memoize").create("m");

		Option outputFile = OptionBuilder.withArgName("file").hasArg()
				.withDescription("Also writes the posterior distribution to <file> in CSV format.")
				.withLongOpt("outputFile").create("o");

		options.addOption(structureFile);
		options.addOption(cptFile);
		options.addOption(query);
		options.addOption(evidence);
		options.addOption(verbose);
		options.addOption(memoize);
		options.addOption(outputFile);

		return options;
	}

	/**
	 * @return process exit status: 0 on success, 1 if the network could not
	 *         be loaded or the query failed, 2 on a usage error
	 */
	static int run(String[] args, PrintStream out, PrintStream err) {

		Options options = createOptions();
		CommandLineParser parser = new GnuParser();

		CommandLine cmd;
		Map<String, String> evidence;
		try {
			cmd = parser.parse(options, args);
			evidence = parseEvidence(cmd.getOptionValues("e"));
		} catch (ParseException e) {
			err.println(e.getMessage());
			HelpFormatter formatter = new HelpFormatter();
			formatter.printHelp("Query", options);
			return 2;
		}

		String query = cmd.getOptionValue("q");

		try {
			BayesNet net = new NetworkReader().read(cmd.getOptionValue("s"), cmd.getOptionValue("c"));

			EnumerationInference inference = cmd.hasOption("m") ? new MemoizedEnumerationInference()
					: new EnumerationInference();
			if (cmd.hasOption("v")) {
				inference.setTraceListener(new PrintStreamTraceListener(out));
				inference.setTraceEnabled(true);
			}

			String given = formatEvidence(evidence);
			Distribution d = inference.ask(net, query, evidence);

			out.println();
			out.println("Distribution of " + query + " given " + (given.isEmpty() ? "no evidence" : given) + ":");
			String condition = given.isEmpty() ? "" : " | " + given;
			for (int i = 0; i < d.size(); i++)
				out.println(String.format("  P(%s=%s%s) = %.6f", query, d.getLabel(i), condition,
						d.getProbability(i)));
			String best = d.getMostProbable();
			out.println(String.format("Most probable value: %s=%s with probability %.6f", query, best,
					d.getProbability(best)));

			if (cmd.hasOption("o"))
				writeCsv(cmd.getOptionValue("o"), d);

		} catch (NetworkFormatException e) {
			err.println("Could not load network: " + e.getMessage());
			return 1;
		} catch (IOException e) {
			logger.debug("I/O failure", e);
			err.println("I/O error: " + e.getMessage());
			return 1;
		} catch (BayesNetException e) {
			err.println("Error: " + e.getMessage());
			return 1;
		}

		return 0;
	}

	/**
	 * Parses {@code node=value} pairs.
	 * 
	 * @throws ParseException
	 *             if a pair is malformed or a node is given two values
	 */
	static Map<String, String> parseEvidence(String[] pairs) throws ParseException {
		Map<String, String> evidence = new LinkedHashMap<String, String>();
		if (pairs == null)
			return evidence;

		for (String pair : pairs) {
			if (pair.trim().isEmpty())
				continue;
			int eq = pair.indexOf('=');
			if (eq < 0)
				throw new ParseException("Evidence '" + pair + "' is not in node=value format.");
			String node = pair.substring(0, eq).trim();
			String value = pair.substring(eq + 1).trim();
			if (node.isEmpty() || value.isEmpty())
				throw new ParseException("Evidence '" + pair + "' is not in node=value format.");
			String previous = evidence.put(node, value);
			if (previous != null && !previous.equals(value))
				throw new ParseException("Evidence gives two values for " + node + ": " + previous + " and "
						+ value + ".");
		}
		return evidence;
	}

	private static String formatEvidence(Map<String, String> evidence) {
		StringBuilder sb = new StringBuilder();
		for (Map.Entry<String, String> e : evidence.entrySet()) {
			if (sb.length() > 0)
				sb.append(", ");
			sb.append(e.getKey() + "=" + e.getValue());
		}
		return sb.toString();
	}

	static void writeCsv(String fileName, Distribution d) throws IOException {
		CSVWriter writer = new CSVWriter(new OutputStreamWriter(new FileOutputStream(fileName),
				StandardCharsets.UTF_8));
		try {
			writer.writeNext(new String[] { "value", "probability" });
			for (int i = 0; i < d.size(); i++)
				writer.writeNext(new String[] { d.getLabel(i), Double.toString(d.getProbability(i)) });
		} finally {
			writer.close();
		}
		logger.info("Posterior of {} written to {}", d.getVariable(), fileName);
	}

}
