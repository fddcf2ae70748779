package com.elphel.dempiv.export;
/**
 **
 ** PivExport - conversion of PIV results to ground units and json output
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PivExport.java is free software: you can redistribute it and/or modify
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
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONTokener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.dempiv.tileprocessor.GeoTransform;
import com.elphel.dempiv.tileprocessor.PivResults;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParser;

/**
 * Writes two index-aligned json documents:
 * <ul>
 * <li>[[x, y, dx, dy], ...] - tile origins and displacements in ground units</li>
 * <li>[[[cxx, cxy], [cyx, cyy]], ...] - displacement covariances in ground units squared</li>
 * </ul>
 */
public class PivExport {
	private static final Logger LOGGER = LoggerFactory.getLogger(PivExport.class);

	public static final String ORIGINS_VECTORS_NAME = "origins_vectors.json";
	public static final String COVARIANCES_NAME =     "covariance_matrices.json";

	private PivExport() {}

	/**
	 * Convert origins and displacement vectors from pixels to ground units. Only the
	 * pixel size and the translation of the transform are used, row axis points south.
	 * @param results PIV results in pixels
	 * @param geo_transform pixel to ground transform of the DEMs
	 * @return [tiles][4] {x, y, dx, dy}
	 */
	public static double [][] getOriginsVectors(PivResults results, GeoTransform geo_transform) {
		double pixel_size = geo_transform.getPixelSize();
		List<double []> origins = results.getOrigins();
		List<double []> vectors = results.getVectors();
		double [][] origins_vectors = new double [results.size()][];
		for (int i = 0; i < origins_vectors.length; i++) {
			double [] origin = origins.get(i);
			double [] vector = vectors.get(i);
			origins_vectors[i] = new double [] {
					origin[0] * pixel_size + geo_transform.getOffsetX(),
					geo_transform.getOffsetY() - origin[1] * pixel_size,
					vector[0] * pixel_size,
					vector[1] * pixel_size};
		}
		return origins_vectors;
	}

	/**
	 * Scale displacement covariances from pixels^2 to ground units^2
	 * @param results PIV results with propagated covariances
	 * @param geo_transform pixel to ground transform of the DEMs
	 * @return [tiles][2][2] covariances
	 */
	public static double [][][] getCovariances(PivResults results, GeoTransform geo_transform) {
		double scale = geo_transform.getPixelSize() * geo_transform.getPixelSize();
		List<double [][]> covariances = results.getCovariances();
		double [][][] scaled = new double [covariances.size()][2][2];
		for (int i = 0; i < scaled.length; i++) {
			double [][] cov = covariances.get(i);
			for (int row = 0; row < 2; row++) {
				for (int col = 0; col < 2; col++) {
					scaled[i][row][col] = cov[row][col] * scale;
				}
			}
		}
		return scaled;
	}

	/**
	 * Write origins/vectors document
	 * @param results PIV results in pixels
	 * @param geo_transform pixel to ground transform
	 * @param output_base_name prefix of the output path, may be empty
	 * @param pretty indent json
	 * @return path of the written file
	 * @throws IOException on write failure
	 */
	public static String exportPiv(
			PivResults   results,
			GeoTransform geo_transform,
			String       output_base_name,
			boolean      pretty) throws IOException
	{
		String path = output_base_name + ORIGINS_VECTORS_NAME;
		writeJson(toJson(getOriginsVectors(results, geo_transform)), path, pretty);
		LOGGER.info("PIV origins and displacement vectors saved to file '"+path+"'");
		return path;
	}

	/**
	 * Write covariances document
	 * @param results PIV results in pixels, propagated
	 * @param geo_transform pixel to ground transform
	 * @param output_base_name prefix of the output path, may be empty
	 * @param pretty indent json
	 * @return path of the written file
	 * @throws IOException on write failure
	 */
	public static String exportUncertainty(
			PivResults   results,
			GeoTransform geo_transform,
			String       output_base_name,
			boolean      pretty) throws IOException
	{
		if (!results.isPropagated()) {
			throw new IllegalArgumentException("Results do not contain propagated covariances");
		}
		String path = output_base_name + COVARIANCES_NAME;
		writeJson(toJson(getCovariances(results, geo_transform)), path, pretty);
		LOGGER.info("PIV displacement vector covariance matrices saved to file '"+path+"'");
		return path;
	}

	public static JSONArray toJson(double [][] data) throws JSONException {
		JSONArray jarr = new JSONArray();
		for (double [] row : data) {
			JSONArray jrow = new JSONArray();
			for (double d : row) {
				jrow.put(d);
			}
			jarr.put(jrow);
		}
		return jarr;
	}

	public static JSONArray toJson(double [][][] data) throws JSONException {
		JSONArray jarr = new JSONArray();
		for (double [][] matrix : data) {
			jarr.put(toJson(matrix));
		}
		return jarr;
	}

	static void writeJson(JSONArray jarr, String path, boolean pretty) throws IOException {
		String json;
		if (pretty) {
			Gson gson = new GsonBuilder().setPrettyPrinting().create();
			JsonElement je = JsonParser.parseString(jarr.toString());
			json = gson.toJson(je);
		} else {
			json = jarr.toString();
		}
		try (Writer writer = Files.newBufferedWriter(Paths.get(path), StandardCharsets.UTF_8)) {
			writer.write(json);
		}
	}

	static JSONArray readJson(String path) throws IOException {
		try (Reader reader = Files.newBufferedReader(Paths.get(path), StandardCharsets.UTF_8)) {
			return new JSONArray(new JSONTokener(reader));
		} catch (JSONException e) {
			throw new IOException("Malformed json in "+path+": "+e.getMessage(), e);
		}
	}

	/**
	 * Read back origins/vectors document
	 * @param path file path
	 * @return [tiles][4] {x, y, dx, dy}
	 * @throws IOException on read failure or malformed file
	 */
	public static double [][] readOriginsVectors(String path) throws IOException {
		JSONArray jarr = readJson(path);
		try {
			return toArray2(jarr);
		} catch (JSONException e) {
			throw new IOException("Unexpected origins/vectors format in "+path+": "+e.getMessage(), e);
		}
	}

	/**
	 * Read back covariances document
	 * @param path file path
	 * @return [tiles][2][2] covariances
	 * @throws IOException on read failure or malformed file
	 */
	public static double [][][] readCovariances(String path) throws IOException {
		JSONArray jarr = readJson(path);
		try {
			double [][][] covariances = new double [jarr.length()][][];
			for (int i = 0; i < covariances.length; i++) {
				covariances[i] = toArray2(jarr.getJSONArray(i));
			}
			return covariances;
		} catch (JSONException e) {
			throw new IOException("Unexpected covariances format in "+path+": "+e.getMessage(), e);
		}
	}

	private static double [][] toArray2(JSONArray jarr) throws JSONException {
		double [][] data = new double [jarr.length()][];
		for (int i = 0; i < data.length; i++) {
			JSONArray jrow = jarr.getJSONArray(i);
			data[i] = new double [jrow.length()];
			for (int j = 0; j < data[i].length; j++) {
				data[i][j] = jrow.getDouble(j);
			}
		}
		return data;
	}
}
