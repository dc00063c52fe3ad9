/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Quarry.
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
package com.hellblazer.quarry.engine.device;

import com.hellblazer.quarry.engine.EngineException.ConfigurationException;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DeviceAffinityTest {

    @Test
    void testRoundRobin() {
        var affinity = DeviceAffinity.roundRobin(2, 5);
        assertEquals(List.of(0, 1, 0, 1, 0), affinity.assignments());
        assertTrue(affinity.isBound());
        assertEquals(2, affinity.deviceCount());
        assertEquals(1, affinity.deviceFor(3).getAsInt());
    }

    @Test
    void testMoreDevicesThanSlots() {
        assertEquals(List.of(0, 1), DeviceAffinity.roundRobin(4, 2).assignments());
    }

    @Test
    void testNoDevices() {
        var affinity = DeviceAffinity.roundRobin(0, 3);
        assertFalse(affinity.isBound());
        assertTrue(affinity.deviceFor(2).isEmpty());
        assertTrue(affinity.assignments().isEmpty());
        assertSame(DeviceAffinity.none(), affinity);
    }

    @Test
    void testInvalidArguments() {
        assertThrows(ConfigurationException.class, () -> DeviceAffinity.roundRobin(-1, 3));
        assertThrows(ConfigurationException.class, () -> DeviceAffinity.roundRobin(2, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> DeviceAffinity.roundRobin(2, 2).deviceFor(2));
    }

    @Test
    void testAssignmentsAreImmutable() {
        var assignments = DeviceAffinity.roundRobin(2, 3).assignments();
        assertThrows(UnsupportedOperationException.class, () -> assignments.set(0, 1));
    }

    @Property
    @Label("Slot i is bound to device i mod D")
    void slotBoundToModulo(@ForAll @IntRange(min = 1, max = 32) int devices,
                           @ForAll @IntRange(min = 1, max = 128) int slots) {
        var affinity = DeviceAffinity.roundRobin(devices, slots);
        var assignments = affinity.assignments();
        assertEquals(slots, assignments.size());
        for (int i = 0; i < slots; i++) {
            assertEquals(i % devices, assignments.get(i));
            assertEquals(i % devices, affinity.deviceFor(i).getAsInt());
        }
    }
}
