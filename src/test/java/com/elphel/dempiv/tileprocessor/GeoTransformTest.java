package com.elphel.dempiv.tileprocessor;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class GeoTransformTest {

	@Test
	public void testCoefficientLayout() {
		GeoTransform gt = GeoTransform.fromCoefficients(500000.0, 2.0, 0.0, 4100000.0, 0.0, -2.0);
		assertArrayEquals(new double [] {2.0, 0.0, 500000.0},  gt.getMatrix()[0], 0.0);
		assertArrayEquals(new double [] {0.0, -2.0, 4100000.0}, gt.getMatrix()[1], 0.0);
		assertArrayEquals(new double [] {0.0, 0.0, 1.0},        gt.getMatrix()[2], 0.0);
		assertEquals(2.0,       gt.getPixelSize(), 0.0);
		assertEquals(500000.0,  gt.getOffsetX(),   0.0);
		assertEquals(4100000.0, gt.getOffsetY(),   0.0);
	}

	@Test
	public void testMatrixIsCopied() {
		double [][] m = {{1.0, 0.0, 10.0}, {0.0, -1.0, 20.0}, {0.0, 0.0, 1.0}};
		GeoTransform gt = new GeoTransform(m);
		m[0][2] = 99.0;
		gt.getMatrix()[0][2] = 99.0;
		assertEquals(10.0, gt.get(0, 2), 0.0);
	}

	@Test
	public void testEquality() {
		assertEquals(GeoTransform.northUp(10.0, 20.0, 0.5), GeoTransform.northUp(10.0, 20.0, 0.5));
		assertEquals(GeoTransform.northUp(10.0, 20.0, 0.5).hashCode(), GeoTransform.northUp(10.0, 20.0, 0.5).hashCode());
		assertNotEquals(GeoTransform.northUp(10.0, 20.0, 0.5), GeoTransform.northUp(10.0, 20.0 + 1e-9, 0.5));
		assertNotEquals(GeoTransform.northUp(10.0, 20.0, 0.5), GeoTransform.identity());
	}

	@Test
	public void testFromPixelScaleAndTiePoint() {
		List<Double> scale =     Arrays.asList(2.0, 3.0, 0.0);
		List<Double> tie_point = Arrays.asList(0.0, 0.0, 0.0, 1000.0, 5000.0, 0.0);
		GeoTransform gt = GeoTransform.fromGeoTiffTags(null, scale, tie_point, GeoTransform.RASTER_PIXEL_IS_AREA);
		assertEquals(GeoTransform.fromCoefficients(1000.0, 2.0, 0.0, 5000.0, 0.0, -3.0), gt);
		// tie point at another raster position
		tie_point = Arrays.asList(10.0, 20.0, 0.0, 1000.0, 5000.0, 0.0);
		gt = GeoTransform.fromGeoTiffTags(null, scale, tie_point, GeoTransform.RASTER_PIXEL_IS_AREA);
		assertEquals(980.0,  gt.getOffsetX(), 0.0);
		assertEquals(5060.0, gt.getOffsetY(), 0.0);
	}

	@Test
	public void testPixelIsPoint() {
		List<Double> scale =     Arrays.asList(2.0, 2.0, 0.0);
		List<Double> tie_point = Arrays.asList(0.0, 0.0, 0.0, 1000.0, 5000.0, 0.0);
		GeoTransform gt = GeoTransform.fromGeoTiffTags(null, scale, tie_point, GeoTransform.RASTER_PIXEL_IS_POINT);
		assertEquals(999.0,  gt.getOffsetX(), 0.0);
		assertEquals(5001.0, gt.getOffsetY(), 0.0);
	}

	@Test
	public void testModelTransformationPriority() {
		List<Double> model = Arrays.asList(
				0.5, 0.0, 0.0, 300.0,
				0.0, -0.5, 0.0, 700.0,
				0.0, 0.0, 0.0, 0.0,
				0.0, 0.0, 0.0, 1.0);
		List<Double> scale =     Arrays.asList(2.0, 2.0, 0.0);
		List<Double> tie_point = Arrays.asList(0.0, 0.0, 0.0, 1000.0, 5000.0, 0.0);
		GeoTransform gt = GeoTransform.fromGeoTiffTags(model, scale, tie_point, -1);
		assertEquals(GeoTransform.fromCoefficients(300.0, 0.5, 0.0, 700.0, 0.0, -0.5), gt);
	}

	@Test
	public void testNotGeoreferenced() {
		assertNull(GeoTransform.fromGeoTiffTags(null, null, null, -1));
		assertNull(GeoTransform.fromGeoTiffTags(null, Arrays.asList(1.0, 1.0, 0.0), null, -1));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNotSquare() {
		new GeoTransform(new double [2][3]);
	}
}
