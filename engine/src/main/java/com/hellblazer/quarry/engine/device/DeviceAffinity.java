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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * Static assignment of accelerator device ids to worker slots.
 *
 * <p>Slot {@code i} is bound to device {@code i % deviceCount}. The assignment is a property of the slot, not of
 * individual tasks: a worker that is recycled or replaced re-derives the same device from its slot index. Device
 * load is not tracked, and no locking is needed since each slot owns its entry.
 *
 * @author hal.hildebrand
 */
public final class DeviceAffinity {

    private static final DeviceAffinity UNBOUND = new DeviceAffinity(0, new int[0]);

    private final int   deviceCount;
    private final int[] slotDevices;

    private DeviceAffinity(int deviceCount, int[] slotDevices) {
        this.deviceCount = deviceCount;
        this.slotDevices = slotDevices;
    }

    /**
     * Workers run without device affinity.
     */
    public static DeviceAffinity none() {
        return UNBOUND;
    }

    /**
     * Round-robin assignment of {@code deviceCount} devices over {@code workerSlots} slots. A device count of zero
     * yields an unbound assignment.
     *
     * @param deviceCount number of devices D
     * @param workerSlots number of worker slots W
     * @return the assignment
     * @throws ConfigurationException if D is negative or W is not positive
     */
    public static DeviceAffinity roundRobin(int deviceCount, int workerSlots) {
        if (deviceCount < 0) {
            throw new ConfigurationException("deviceCount must be non-negative: " + deviceCount);
        }
        if (workerSlots <= 0) {
            throw new ConfigurationException("workerSlots must be positive: " + workerSlots);
        }
        if (deviceCount == 0) {
            return UNBOUND;
        }
        var devices = new int[workerSlots];
        for (int slot = 0; slot < workerSlots; slot++) {
            devices[slot] = slot % deviceCount;
        }
        return new DeviceAffinity(deviceCount, devices);
    }

    public boolean isBound() {
        return deviceCount > 0;
    }

    public int deviceCount() {
        return deviceCount;
    }

    /**
     * Device bound to a worker slot.
     *
     * @param slot the worker slot
     * @return the device id, or empty when workers are unbound
     */
    public OptionalInt deviceFor(int slot) {
        if (!isBound()) {
            return OptionalInt.empty();
        }
        if (slot < 0 || slot >= slotDevices.length) {
            throw new IndexOutOfBoundsException("Slot:" + slot + ", Slots:" + slotDevices.length);
        }
        return OptionalInt.of(slotDevices[slot]);
    }

    /**
     * The device ids in slot order, i.e. the order in which workers consume them at start-up.
     */
    public List<Integer> assignments() {
        var list = new ArrayList<Integer>(slotDevices.length);
        for (int device : slotDevices) {
            list.add(device);
        }
        return Collections.unmodifiableList(list);
    }

    @Override
    public String toString() {
        return isBound() ? String.format("DeviceAffinity[devices=%d, slots=%s]", deviceCount, assignments())
                         : "DeviceAffinity[unbound]";
    }
}
