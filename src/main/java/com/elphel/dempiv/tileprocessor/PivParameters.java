package com.elphel.dempiv.tileprocessor;
/**
 **
 ** PivParameters - parameters of the DEM PIV processing
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PivParameters.java is free software: you can redistribute it and/or modify
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

import java.util.Properties;

public class PivParameters {
	public int         template_size =     9;     // square correlation template side, pixels (>= 3)
	public int         step_size =         5;     // template step, pixels (>= 1)
	public boolean     propagate =         false; // propagate height uncertainty into displacement covariance
	public double      partial_increment = CorrelationUncertainty.DEFAULT_PARTIAL_INCREMENT; // numeric partial derivative increment, height units
	public int         threads_max =       100;   // maximal number of threads to launch
	public int         debug_level =       0;
	public String      output_base_name =  "";    // prepended to the output file names
	public boolean     pretty_json =       false; // indent output json files

	public void validate() {
		if (template_size < TileScanner.MIN_TEMPLATE_SIZE) {
			throw new IllegalArgumentException("template_size should be >= "+TileScanner.MIN_TEMPLATE_SIZE+", got "+template_size);
		}
		if (step_size < 1) {
			throw new IllegalArgumentException("step_size should be >= 1, got "+step_size);
		}
		if (!(partial_increment > 0.0) || Double.isInfinite(partial_increment)) {
			throw new IllegalArgumentException("partial_increment should be positive, got "+partial_increment);
		}
	}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"template_size",     this.template_size+"");
		properties.setProperty(prefix+"step_size",         this.step_size+"");
		properties.setProperty(prefix+"propagate",         this.propagate+"");
		properties.setProperty(prefix+"partial_increment", this.partial_increment+"");
		properties.setProperty(prefix+"threads_max",       this.threads_max+"");
		properties.setProperty(prefix+"debug_level",       this.debug_level+"");
		properties.setProperty(prefix+"output_base_name",  this.output_base_name);
		properties.setProperty(prefix+"pretty_json",       this.pretty_json+"");
	}

	public void getProperties(String prefix,Properties properties){
		if (properties.getProperty(prefix+"template_size")!=null)     this.template_size=Integer.parseInt(properties.getProperty(prefix+"template_size").trim());
		if (properties.getProperty(prefix+"step_size")!=null)         this.step_size=Integer.parseInt(properties.getProperty(prefix+"step_size").trim());
		if (properties.getProperty(prefix+"propagate")!=null)         this.propagate=Boolean.parseBoolean(properties.getProperty(prefix+"propagate").trim());
		if (properties.getProperty(prefix+"partial_increment")!=null) this.partial_increment=Double.parseDouble(properties.getProperty(prefix+"partial_increment").trim());
		if (properties.getProperty(prefix+"threads_max")!=null)       this.threads_max=Integer.parseInt(properties.getProperty(prefix+"threads_max").trim());
		if (properties.getProperty(prefix+"debug_level")!=null)       this.debug_level=Integer.parseInt(properties.getProperty(prefix+"debug_level").trim());
		if (properties.getProperty(prefix+"output_base_name")!=null)  this.output_base_name=properties.getProperty(prefix+"output_base_name");
		if (properties.getProperty(prefix+"pretty_json")!=null)       this.pretty_json=Boolean.parseBoolean(properties.getProperty(prefix+"pretty_json").trim());
	}

	@Override
	public PivParameters clone() {
		PivParameters pp =        new PivParameters();
		pp.template_size =        this.template_size;
		pp.step_size =            this.step_size;
		pp.propagate =            this.propagate;
		pp.partial_increment =    this.partial_increment;
		pp.threads_max =          this.threads_max;
		pp.debug_level =          this.debug_level;
		pp.output_base_name =     this.output_base_name;
		pp.pretty_json =          this.pretty_json;
		return pp;
	}
}
