package com.elphel.dempiv.readers;
/**
 **
 ** DemReader - reading DEM and DEM uncertainty GeoTIFF files
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DemReader.java is free software: you can redistribute it and/or modify
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

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.dempiv.tileprocessor.GeoTransform;
import com.elphel.dempiv.tileprocessor.HeightGrid;
import com.elphel.dempiv.tileprocessor.PivProcessor;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.util.TiffException;

/**
 * Pixel data (first band) and georeferencing are read from the first image file
 * directory of a GeoTIFF. Integer and floating point samples of any width are
 * converted to double.
 */
public class DemReader {
	private static final Logger LOGGER = LoggerFactory.getLogger(DemReader.class);

	public static final int TAG_MODEL_PIXEL_SCALE =    33550;
	public static final int TAG_MODEL_TIEPOINT =       33922;
	public static final int TAG_MODEL_TRANSFORMATION = 34264;
	public static final int TAG_GEO_KEY_DIRECTORY =    34735;
	public static final int GEOKEY_RASTER_TYPE =       1025;

	/** DEM pair with optional uncertainties, validated to be processed together */
	public static class DemInputs {
		public final HeightGrid   before;
		public final HeightGrid   after;
		public final HeightGrid   before_sigma; // null if not propagating
		public final HeightGrid   after_sigma;  // null if not propagating
		public final GeoTransform geo_transform;
		DemInputs(
				HeightGrid   before,
				HeightGrid   after,
				HeightGrid   before_sigma,
				HeightGrid   after_sigma,
				GeoTransform geo_transform)
		{
			this.before =        before;
			this.after =         after;
			this.before_sigma =  before_sigma;
			this.after_sigma =   after_sigma;
			this.geo_transform = geo_transform;
		}
	}

	private DemReader() {}

	/**
	 * Read and validate PIV inputs
	 * @param before_path "before" DEM
	 * @param after_path "after" DEM
	 * @param before_sigma_path "before" uncertainty raster or null
	 * @param after_sigma_path "after" uncertainty raster or null (should be null together with before_sigma_path)
	 * @return loaded inputs
	 * @throws IOException if a file can not be read
	 */
	public static DemInputs readInputs(
			String before_path,
			String after_path,
			String before_sigma_path,
			String after_sigma_path) throws IOException
	{
		if ((before_sigma_path == null) != (after_sigma_path == null)) {
			throw new IllegalArgumentException("Both 'before' and 'after' uncertainty files are required");
		}
		FileDirectory before_directory = readFirstDirectory(before_path);
		FileDirectory after_directory =  readFirstDirectory(after_path);
		HeightGrid   before =           getHeightGrid(before_directory, before_path);
		GeoTransform before_transform = getGeoTransform(before_directory, before_path);
		HeightGrid   after =            getHeightGrid(after_directory, after_path);
		GeoTransform after_transform =  getGeoTransform(after_directory, after_path);
		HeightGrid before_sigma = null;
		HeightGrid after_sigma =  null;
		if (before_sigma_path != null) {
			before_sigma = readHeightGrid(before_sigma_path);
			after_sigma =  readHeightGrid(after_sigma_path);
		}
		PivProcessor.validateInputs(
				before,
				before_transform,
				after,
				after_transform,
				before_sigma,
				after_sigma);
		return new DemInputs(before, after, before_sigma, after_sigma, before_transform);
	}

	/**
	 * Read the first image file directory of a TIFF file
	 * @param path TIFF file path
	 * @return first directory
	 * @throws IOException if the file is missing, malformed or has no images
	 */
	static FileDirectory readFirstDirectory(String path) throws IOException {
		File file = new File(path);
		if (!file.isFile()) {
			throw new FileNotFoundException("Raster file "+path+" does not exist");
		}
		TIFFImage tiffImage;
		try {
			tiffImage = TiffReader.readTiff(file);
		} catch (TiffException e) {
			throw new IOException("Failed to parse TIFF "+path+": "+e.getMessage(), e);
		}
		if ((tiffImage.getFileDirectories() == null) || tiffImage.getFileDirectories().isEmpty()) {
			throw new IOException("No image file directories in "+path);
		}
		return tiffImage.getFileDirectories().get(0);
	}

	/**
	 * Read the first band of a raster file
	 * @param path TIFF file path
	 * @return grid of pixel values
	 * @throws IOException if the file is missing or is not a supported image
	 */
	public static HeightGrid readHeightGrid(String path) throws IOException {
		return getHeightGrid(readFirstDirectory(path), path);
	}

	static HeightGrid getHeightGrid(FileDirectory directory, String path) throws IOException {
		Rasters rasters;
		try {
			rasters = directory.readRasters();
		} catch (TiffException e) {
			throw new IOException("Failed to read raster from "+path+": "+e.getMessage(), e);
		}
		int width =  rasters.getWidth();
		int height = rasters.getHeight();
		double [] data = new double [width * height];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				data[y * width + x] = rasters.getFirstPixelSample(x, y).doubleValue();
			}
		}
		LOGGER.debug("readHeightGrid(): "+path+" - "+width+"x"+height+", "+rasters.getSamplesPerPixel()+" band(s), "+
				directory.getBitsPerSample()+" bits per sample");
		return new HeightGrid(width, height, data);
	}

	/**
	 * Read pixel to ground transform from GeoTIFF tags
	 * @param path TIFF file path
	 * @return transform, identity if the file is not georeferenced
	 * @throws IOException if the file can not be parsed
	 */
	public static GeoTransform readGeoTransform(String path) throws IOException {
		return getGeoTransform(readFirstDirectory(path), path);
	}

	static GeoTransform getGeoTransform(FileDirectory directory, String path) {
		GeoTransform geo_transform = GeoTransform.fromGeoTiffTags(
				getTagValues(directory, TAG_MODEL_TRANSFORMATION, Double.class),
				getTagValues(directory, TAG_MODEL_PIXEL_SCALE,    Double.class),
				getTagValues(directory, TAG_MODEL_TIEPOINT,       Double.class),
				getGeoKey(getTagValues(directory, TAG_GEO_KEY_DIRECTORY, Integer.class), GEOKEY_RASTER_TYPE));
		if (geo_transform == null) {
			LOGGER.warn("Raster "+path+" is not georeferenced, using identity pixel to ground transform");
			geo_transform = GeoTransform.identity();
		}
		return geo_transform;
	}

	/**
	 * Get short value of a GeoKey stored directly in the GeoKeyDirectory
	 * @param geo_key_directory GeoKeyDirectoryTag values or null
	 * @param key GeoKey ID
	 * @return key value or -1 if not found
	 */
	static int getGeoKey(List<Integer> geo_key_directory, int key) {
		if ((geo_key_directory == null) || (geo_key_directory.size() < 4)) {
			return -1;
		}
		int num_keys = geo_key_directory.get(3);
		for (int i = 0; i < num_keys; i++) {
			int indx = 4 * (i + 1);
			if ((indx + 3) >= geo_key_directory.size()) {
				break;
			}
			if ((geo_key_directory.get(indx) == key) && (geo_key_directory.get(indx + 1) == 0)) {
				return geo_key_directory.get(indx + 3);
			}
		}
		return -1;
	}

	/**
	 * Extract tag values of the expected type from the directory
	 * @return list of values or null if the tag is missing
	 */
	static <T> List<T> getTagValues(FileDirectory directory, int tag, Class<T> type) {
		FieldTagType field_tag = FieldTagType.getById(tag);
		if ((field_tag == null) || (directory.getEntries() == null)) {
			return null;
		}
		for (FileDirectoryEntry entry : directory.getEntries()) {
			if (entry.getFieldTag() == field_tag) {
				Object values = entry.getValues();
				List<T> typed_values = new ArrayList<T>();
				if (values instanceof List<?>) {
					for (Object item: (List<?>) values) {
						if (type.isInstance(item)) {
							typed_values.add(type.cast(item));
						}
					}
				} else if (type.isInstance(values)) {
					typed_values.add(type.cast(values));
				}
				return typed_values;
			}
		}
		return null;
	}
}
