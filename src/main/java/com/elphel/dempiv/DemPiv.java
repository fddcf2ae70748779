package com.elphel.dempiv;
/**
 **
 ** DemPiv - command line PIV between pre- and post-event DEMs
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DemPiv.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.dempiv.export.PivExport;
import com.elphel.dempiv.readers.DemReader;
import com.elphel.dempiv.tileprocessor.PivParameters;
import com.elphel.dempiv.tileprocessor.PivProcessor;
import com.elphel.dempiv.tileprocessor.PivResults;

public class DemPiv {
	private static final Logger LOGGER = LoggerFactory.getLogger(DemPiv.class);

	public static final String PROPERTIES_PREFIX = "PIV.";
	public static final int    EXIT_OK =    0;
	public static final int    EXIT_ERROR = 1;
	public static final int    EXIT_USAGE = 2;

	public static final String USAGE =
			"Usage: DemPiv BEFORE_HEIGHT AFTER_HEIGHT TEMPLATE_SIZE STEP_SIZE [options]\n"+
			"Runs PIV on a pair of pre- and post-event DEMs.\n"+
			"  BEFORE_HEIGHT  Pre-event DEM in GeoTIFF format\n"+
			"  AFTER_HEIGHT   Post-event DEM in GeoTIFF format\n"+
			"  TEMPLATE_SIZE  Size of square correlation template in pixels (>= 3)\n"+
			"  STEP_SIZE      Size of template step in pixels (>= 1)\n"+
			"Options:\n"+
			"  --prop BEFORE_UNCERTAINTY AFTER_UNCERTAINTY  propagate error, uncertainties in GeoTIFF format\n"+
			"  --outname NAME   base filename for the output files\n"+
			"  --config FILE    properties file with "+PROPERTIES_PREFIX+"* parameters\n"+
			"  --threads N      maximal number of threads\n"+
			"  --debug N        debug level\n"+
			"  --pretty         indent output json\n";

	/** Parsed command line */
	static class Arguments {
		String        before_height;
		String        after_height;
		String        before_uncertainty = null;
		String        after_uncertainty =  null;
		PivParameters pivParameters;
	}

	public static void main(String[] args) {
		System.exit(run(args));
	}

	/**
	 * Run PIV from command line arguments
	 * @param args command line arguments
	 * @return process exit status
	 */
	public static int run(String[] args) {
		Arguments arguments;
		try {
			arguments = parseArguments(args);
		} catch (IllegalArgumentException e) {
			System.err.println(e.getMessage());
			System.err.print(USAGE);
			return EXIT_USAGE;
		} catch (IOException e) {
			LOGGER.error("Failed to read configuration: "+e.getMessage());
			return EXIT_ERROR;
		}
		try {
			piv(arguments);
		} catch (IllegalArgumentException e) {
			LOGGER.error(e.getMessage());
			return EXIT_ERROR;
		} catch (IOException e) {
			LOGGER.error("I/O failure: "+e.getMessage());
			return EXIT_ERROR;
		}
		return EXIT_OK;
	}

	static void piv(Arguments arguments) throws IOException {
		PivParameters pp = arguments.pivParameters;
		DemReader.DemInputs inputs = DemReader.readInputs(
				arguments.before_height,
				arguments.after_height,
				pp.propagate ? arguments.before_uncertainty : null,
				pp.propagate ? arguments.after_uncertainty :  null);
		PivProcessor pivProcessor = new PivProcessor(pp);
		PivResults results = pivProcessor.process(
				inputs.before,
				inputs.after,
				inputs.before_sigma,
				inputs.after_sigma);
		PivExport.exportPiv(
				results,
				inputs.geo_transform,
				pp.output_base_name,
				pp.pretty_json);
		if (pp.propagate) {
			PivExport.exportUncertainty(
					results,
					inputs.geo_transform,
					pp.output_base_name,
					pp.pretty_json);
		}
	}

	/**
	 * Parse command line. Values from --config file are applied first, explicit
	 * options override them.
	 * @param args command line arguments
	 * @return parsed arguments
	 * @throws IOException if configuration file can not be read
	 */
	static Arguments parseArguments(String [] args) throws IOException {
		List<String> positional = new ArrayList<String>();
		Arguments arguments = new Arguments();
		String  config_path = null;
		String  outname =     null;
		Integer threads =     null;
		Integer debug =       null;
		boolean pretty =      false;
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			switch (arg) {
			case "--prop":
				if ((i + 2) >= args.length) {
					throw new IllegalArgumentException("--prop requires two arguments");
				}
				arguments.before_uncertainty = args[++i];
				arguments.after_uncertainty =  args[++i];
				break;
			case "--outname":
				outname = optionValue(args, ++i, arg);
				break;
			case "--config":
				config_path = optionValue(args, ++i, arg);
				break;
			case "--threads":
				threads = parseInt(optionValue(args, ++i, arg), arg, 1);
				break;
			case "--debug":
				debug = parseInt(optionValue(args, ++i, arg), arg, Integer.MIN_VALUE);
				break;
			case "--pretty":
				pretty = true;
				break;
			default:
				if (arg.startsWith("--")) {
					throw new IllegalArgumentException("Unknown option "+arg);
				}
				positional.add(arg);
			}
		}
		if (positional.size() != 4) {
			throw new IllegalArgumentException("Expected 4 arguments, got "+positional.size());
		}
		PivParameters pp = new PivParameters();
		if (config_path != null) {
			Properties properties = new Properties();
			try (InputStream is = Files.newInputStream(Paths.get(config_path))) {
				properties.load(is);
			}
			pp.getProperties(PROPERTIES_PREFIX, properties);
		}
		arguments.before_height = positional.get(0);
		arguments.after_height =  positional.get(1);
		pp.template_size = parseInt(positional.get(2), "TEMPLATE_SIZE", 3);
		pp.step_size =     parseInt(positional.get(3), "STEP_SIZE", 1);
		if (arguments.before_uncertainty != null) {
			pp.propagate = true;
		} else if (pp.propagate) {
			throw new IllegalArgumentException("Propagation requires --prop BEFORE_UNCERTAINTY AFTER_UNCERTAINTY");
		}
		if (outname != null) pp.output_base_name = outname + "_";
		if (threads != null) pp.threads_max =      threads;
		if (debug != null)   pp.debug_level =      debug;
		if (pretty)          pp.pretty_json =      true;
		pp.validate();
		arguments.pivParameters = pp;
		return arguments;
	}

	private static String optionValue(String [] args, int i, String option) {
		if (i >= args.length) {
			throw new IllegalArgumentException(option+" requires an argument");
		}
		return args[i];
	}

	private static int parseInt(String s, String name, int min) {
		int value;
		try {
			value = Integer.parseInt(s);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(name+" should be an integer, got '"+s+"'");
		}
		if (value < min) {
			throw new IllegalArgumentException(name+" should be >= "+min+", got "+value);
		}
		return value;
	}
}
