package com.elphel.dempiv.tileprocessor;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Properties;

import org.junit.Test;

public class PivParametersTest {

	@Test
	public void testDefaults() {
		PivParameters pp = new PivParameters();
		assertEquals(9, pp.template_size);
		assertEquals(5, pp.step_size);
		assertFalse(pp.propagate);
		assertEquals(1e-6, pp.partial_increment, 0.0);
		assertEquals("", pp.output_base_name);
		pp.validate();
	}

	@Test
	public void testPropertiesRoundTrip() {
		PivParameters pp = new PivParameters();
		pp.template_size =     12;
		pp.step_size =         3;
		pp.propagate =         true;
		pp.partial_increment = 1e-5;
		pp.threads_max =       2;
		pp.debug_level =       1;
		pp.output_base_name =  "slide_";
		pp.pretty_json =       true;
		Properties properties = new Properties();
		pp.setProperties("PIV.", properties);
		PivParameters restored = new PivParameters();
		restored.getProperties("PIV.", properties);
		assertEquals(12, restored.template_size);
		assertEquals(3,  restored.step_size);
		assertTrue(restored.propagate);
		assertEquals(1e-5, restored.partial_increment, 0.0);
		assertEquals(2,  restored.threads_max);
		assertEquals(1,  restored.debug_level);
		assertEquals("slide_", restored.output_base_name);
		assertTrue(restored.pretty_json);
	}

	@Test
	public void testMissingPropertiesKeepValues() {
		Properties properties = new Properties();
		properties.setProperty("PIV.step_size", " 7 ");
		PivParameters pp = new PivParameters();
		pp.getProperties("PIV.", properties);
		assertEquals(7, pp.step_size);
		assertEquals(9, pp.template_size);
	}

	@Test
	public void testCloneIsIndependent() {
		PivParameters pp = new PivParameters();
		PivParameters copy = pp.clone();
		copy.template_size = 15;
		assertEquals(9, pp.template_size);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testValidateTemplateSize() {
		PivParameters pp = new PivParameters();
		pp.template_size = 2;
		pp.validate();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testValidateIncrement() {
		PivParameters pp = new PivParameters();
		pp.partial_increment = 0.0;
		pp.validate();
	}
}
