package org.caureq.fabricops.service.device;

import org.caureq.fabricops.domain.DeviceDescriptor;
import org.caureq.fabricops.domain.DeviceState;
import org.caureq.fabricops.service.error.ChangeCancelledException;
import org.caureq.fabricops.service.error.DeviceRejectedException;
import org.caureq.fabricops.service.error.DeviceTimeoutException;
import org.caureq.fabricops.service.error.DeviceUnreachableException;

import java.time.Duration;
import java.util.List;

/**
 * Transport to one network device. Implementations must honour the timeout and
 * stop when the calling thread is interrupted: they restore the interrupt flag and
 * throw {@link ChangeCancelledException} without a commit id.
 */
public interface DeviceExecutor {

    /**
     * Reads the current state of a port.
     *
     * @throws DeviceUnreachableException transport or authentication failure
     * @throws DeviceTimeoutException no answer within {@code timeout}
     */
    DeviceState readState(DeviceDescriptor device, String iface, Duration timeout);

    /**
     * Pushes configuration lines, in order, in configuration mode.
     *
     * @throws DeviceUnreachableException transport or authentication failure
     * @throws DeviceTimeoutException no answer within {@code timeout}
     * @throws DeviceRejectedException the device refused one of the lines
     */
    void applyCommands(DeviceDescriptor device, List<String> commands, Duration timeout);
}
