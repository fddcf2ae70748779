package com.elphel.dempiv.export;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.elphel.dempiv.tileprocessor.GeoTransform;
import com.elphel.dempiv.tileprocessor.PivResults;

public class PivExportTest {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private PivResults results;

	@Before
	public void setUp() {
		results = new PivResults(true);
		results.add(0, new double [] {9.0, 9.0},  new double [] {1.25, -0.5},  new double [][] {{0.01, 0.002}, {0.002, 0.03}});
		results.add(3, new double [] {24.0, 9.0}, new double [] {-0.3, 0.125}, new double [][] {{0.04, -0.001}, {-0.001, 0.02}});
	}

	@Test
	public void testPixelSizeScaling() {
		GeoTransform gt1 = GeoTransform.northUp(0.0, 0.0, 1.0);
		GeoTransform gt2 = GeoTransform.northUp(0.0, 0.0, 2.0);
		double [][]   ov1 =  PivExport.getOriginsVectors(results, gt1);
		double [][]   ov2 =  PivExport.getOriginsVectors(results, gt2);
		double [][][] cov1 = PivExport.getCovariances(results, gt1);
		double [][][] cov2 = PivExport.getCovariances(results, gt2);
		for (int i = 0; i < results.size(); i++) {
			for (int j = 0; j < 4; j++) {
				assertEquals(2.0 * ov1[i][j], ov2[i][j], 1e-12);
			}
			for (int row = 0; row < 2; row++) {
				for (int col = 0; col < 2; col++) {
					assertEquals(4.0 * cov1[i][row][col], cov2[i][row][col], 1e-12);
				}
			}
		}
	}

	@Test
	public void testGroundCoordinates() {
		GeoTransform gt = GeoTransform.northUp(500000.0, 4100000.0, 0.5);
		double [][] ov = PivExport.getOriginsVectors(results, gt);
		assertArrayEquals(new double [] {500004.5, 4099995.5, 0.625, -0.25}, ov[0], 1e-9);
		assertArrayEquals(new double [] {500012.0, 4099995.5, -0.15, 0.0625}, ov[1], 1e-9);
	}

	@Test
	public void testWriteAndReadBack() throws IOException {
		GeoTransform gt = GeoTransform.northUp(500000.0, 4100000.0, 0.5);
		String base = new File(folder.getRoot(), "slide_").getPath();
		String ov_path =  PivExport.exportPiv(results, gt, base, false);
		String cov_path = PivExport.exportUncertainty(results, gt, base, false);
		assertEquals(base + PivExport.ORIGINS_VECTORS_NAME, ov_path);
		assertEquals(base + PivExport.COVARIANCES_NAME,     cov_path);
		double [][]   ov =  PivExport.getOriginsVectors(results, gt);
		double [][][] cov = PivExport.getCovariances(results, gt);
		double [][]   ov_read =  PivExport.readOriginsVectors(ov_path);
		double [][][] cov_read = PivExport.readCovariances(cov_path);
		assertEquals(ov.length,  ov_read.length);
		assertEquals(cov.length, cov_read.length);
		for (int i = 0; i < ov.length; i++) {
			for (int j = 0; j < 4; j++) {
				assertEquals(ov[i][j], ov_read[i][j], 1e-9 * Math.abs(ov[i][j]));
			}
			for (int row = 0; row < 2; row++) {
				assertArrayEquals(cov[i][row], cov_read[i][row], 1e-9 * Math.abs(cov[i][row][row]));
			}
		}
	}

	@Test
	public void testPrettyOutput() throws IOException {
		GeoTransform gt = GeoTransform.identity();
		String compact = PivExport.exportPiv(results, gt, new File(folder.getRoot(), "a_").getPath(), false);
		String pretty =  PivExport.exportPiv(results, gt, new File(folder.getRoot(), "b_").getPath(), true);
		String compact_text = new String(Files.readAllBytes(Paths.get(compact)), StandardCharsets.UTF_8);
		String pretty_text =  new String(Files.readAllBytes(Paths.get(pretty)),  StandardCharsets.UTF_8);
		assertTrue(compact_text.startsWith("[["));
		assertTrue(pretty_text.contains("\n"));
		double [][] a = PivExport.readOriginsVectors(compact);
		double [][] b = PivExport.readOriginsVectors(pretty);
		for (int i = 0; i < a.length; i++) {
			assertArrayEquals(a[i], b[i], 0.0);
		}
	}

	@Test
	public void testEmptyResults() throws IOException {
		String path = PivExport.exportPiv(new PivResults(false), GeoTransform.identity(), new File(folder.getRoot(), "empty_").getPath(), false);
		assertEquals("[]", new String(Files.readAllBytes(Paths.get(path)), StandardCharsets.UTF_8).trim());
		assertEquals(0, PivExport.readOriginsVectors(path).length);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUncertaintyRequiresPropagation() throws IOException {
		PivExport.exportUncertainty(new PivResults(false), GeoTransform.identity(), new File(folder.getRoot(), "x_").getPath(), false);
	}

	@Test(expected = IOException.class)
	public void testMalformedFile() throws IOException {
		File file = folder.newFile("bad.json");
		Files.write(file.toPath(), "[[1, 2".getBytes(StandardCharsets.UTF_8));
		PivExport.readOriginsVectors(file.getPath());
	}
}
