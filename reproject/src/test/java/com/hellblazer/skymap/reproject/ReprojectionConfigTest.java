/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.skymap.reproject;

import com.hellblazer.skymap.common.ConfigurationException;
import com.hellblazer.skymap.geometry.CoordinateFrame;
import com.hellblazer.skymap.reproject.wcs.Projection;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ReprojectionConfigTest {

    @Test
    void testDefaults() {
        var config = ReprojectionConfig.defaults();
        assertEquals(Projection.CAR, config.getProjection());
        assertEquals(2, config.getOversample());
        assertTrue(config.isNormalize());
        assertFalse(config.isSumPlanes());
        assertFalse(config.isParallel());
        assertEquals(65_536, config.getParallelThreshold());
        assertTrue(config.getTargetFrame().isEmpty());
        assertFalse(config.useParallel(1_000_000));
    }

    @Test
    void testPresets() {
        assertFalse(ReprojectionConfig.intensityPreserving().isNormalize());
        var fast = ReprojectionConfig.highThroughput();
        assertTrue(fast.isParallel());
        assertTrue(fast.useParallel(fast.getParallelThreshold()));
        assertFalse(fast.useParallel(fast.getParallelThreshold() - 1));
    }

    @Test
    void testFluentSettings() {
        var config = ReprojectionConfig.defaults()
                                       .withProjection("tan")
                                       .withOversample(4)
                                       .withSumPlanes(true)
                                       .withTargetFrame(CoordinateFrame.GALACTIC);
        assertEquals(Projection.TAN, config.getProjection());
        assertEquals(4, config.getOversample());
        assertTrue(config.isSumPlanes());
        assertEquals(CoordinateFrame.GALACTIC, config.getTargetFrame().orElseThrow());
    }

    @Test
    void testValidation() {
        var config = ReprojectionConfig.defaults();
        assertThrows(ConfigurationException.class, () -> config.withOversample(0));
        assertThrows(ConfigurationException.class, () -> config.withParallelThreshold(-1));
        assertThrows(ConfigurationException.class, () -> config.withProjection("MER"));
        assertThrows(ConfigurationException.class, () -> config.withProjection((Projection) null));
    }
}
