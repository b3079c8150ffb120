package org.lexidex.indexing;

import org.lexidex.indexing.bootstrap.IndexingBootstrap;

import java.util.HashMap;
import java.util.Map;

public class IndexingApp {

	public static void main(String[] args) {
		Map<String, String> overrides;
		try {
			overrides = parseArguments(args);
		} catch (IllegalArgumentException e) {
			System.err.println(e.getMessage());
			printUsage();
			System.exit(1);
			return;
		}
		if (overrides == null) {
			printUsage();
			return;
		}
		IndexingBootstrap.run(overrides);
	}

	/**
	 * Parse command line arguments into configuration overrides, or null when help was requested
	 */
	static Map<String, String> parseArguments(String[] args) {
		Map<String, String> overrides = new HashMap<>();
		for (String arg : args) {
			if (arg.equals("-h") || arg.equals("--help")) {
				return null;
			} else if (arg.startsWith("--corpus=")) {
				overrides.put("corpus.path", arg.substring("--corpus=".length()));
			} else if (arg.startsWith("--output=")) {
				overrides.put("index.output.path", arg.substring("--output=".length()));
			} else {
				throw new IllegalArgumentException("Unknown argument: " + arg);
			}
		}
		return overrides;
	}

	private static void printUsage() {
		System.out.println("\n=== Indexing Service Usage ===\n");
		System.out.println("Usage: java -jar indexing-service-1.0.0.jar [options]\n");
		System.out.println("Options:");
		System.out.println("  --corpus=<dir>     Directory of .txt documents (default: corpus)");
		System.out.println("  --output=<dir>     Directory the index bundle is written to (default: data)");
		System.out.println("  -h, --help         Show this help message\n");
		System.out.println("Environment:");
		System.out.println("  CORPUS_PATH, INDEX_OUTPUT_PATH override the same settings\n");
	}
}
