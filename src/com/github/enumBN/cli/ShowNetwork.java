package com.github.enumBN.cli;

import java.io.IOException;
import java.io.PrintStream;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionBuilder;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import com.github.enumBN.bn.BayesNet;
import com.github.enumBN.bn.BayesNetException;
import com.github.enumBN.bn.NetworkFormatException;
import com.github.enumBN.bn.NetworkReader;
import com.github.enumBN.utils.Utils;

public class ShowNetwork {

	public static void main(String[] args) {
		int status = run(args, System.out, System.err);
		if (status != 0)
			System.exit(status);
	}

	@SuppressWarnings({ "static-access" })
	static int run(String[] args, PrintStream out, PrintStream err) {

		// create Options object
		Options options = new Options();

		Option structureFile = OptionBuilder.withArgName("file").hasArg().isRequired()
				.withDescription("Network structure file, one 'Parent -> Child' edge per line.")
				.withLongOpt("structureFile").create("s");

		Option cptFile = OptionBuilder.withArgName("file").hasArg().isRequired()
				.withDescription("Conditional probability tables file, one NODE ... ENDNODE block per node.")
				.withLongOpt("cptFile").create("c");

		Option tables = OptionBuilder.withDescription("Also prints the conditional probability tables.")
				.withLongOpt("tables").create("t");

		Option dotFormat = OptionBuilder
				.withDescription(
						"Outputs network in dot format, allowing direct redirection into Graphviz to visualize the graph.")
				.withLongOpt("dotFormat").create("d");

		Option outputFile = OptionBuilder.withArgName("file").hasArg()
				.withDescription("Writes output to <file>. If not supplied, output is written to terminal.")
				.withLongOpt("outputFile").create("o");

		options.addOption(structureFile);
		options.addOption(cptFile);
		options.addOption(tables);
		options.addOption(dotFormat);
		options.addOption(outputFile);

		CommandLineParser parser = new GnuParser();
		CommandLine cmd;
		try {
			cmd = parser.parse(options, args);
		} catch (ParseException e) {
			err.println(e.getMessage());
			HelpFormatter formatter = new HelpFormatter();
			formatter.printHelp("ShowNetwork", options);
			return 2;
		}

		try {
			BayesNet net = new NetworkReader().read(cmd.getOptionValue("s"), cmd.getOptionValue("c"));

			String output;
			if (cmd.hasOption("d"))
				output = net.toDot();
			else if (cmd.hasOption("t"))
				output = net.toString() + net.cptsToString();
			else
				output = net.toString();

			if (cmd.hasOption("o")) {
				try {
					Utils.writeToFile(cmd.getOptionValue("o"), output);
				} catch (IOException e) {
					err.println("Could not write to " + cmd.getOptionValue("o") + ": " + e.getMessage());
					return 1;
				}
			} else {
				out.println();
				out.println(output);
			}

		} catch (NetworkFormatException e) {
			err.println("Could not load network: " + e.getMessage());
			return 1;
		} catch (IOException e) {
			err.println("I/O error: " + e.getMessage());
			return 1;
		} catch (BayesNetException e) {
			err.println("Error: " + e.getMessage());
			return 1;
		}

		return 0;
	}

}
