package org.caureq.fabricops.service.device;

import lombok.extern.slf4j.Slf4j;
import org.caureq.fabricops.domain.DeviceDescriptor;
import org.caureq.fabricops.domain.DeviceState;
import org.caureq.fabricops.domain.PortStatus;
import org.caureq.fabricops.service.error.ChangeCancelledException;
import org.caureq.fabricops.service.error.DeviceRejectedException;
import org.caureq.fabricops.service.error.DeviceTimeoutException;
import org.caureq.fabricops.service.error.Stage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * In-memory fabric for labs and demos. Every Ethernet/port-channel port exists,
 * starts admin up / oper down with no MAC learned, and remembers what was pushed to it.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "fabric.executor", havingValue = "simulated", matchIfMissing = true)
public class SimulatedDeviceExecutor implements DeviceExecutor {
    private static final Pattern PORT_NAME =
            Pattern.compile("^(?i)(eth|ethernet|po|port-channel)\\d+(/\\d+){0,2}$");

    private final Duration latency;
    private final Map<String, SimPort> ports = new ConcurrentHashMap<>();

    public SimulatedDeviceExecutor(@Value("${fabric.simulated.latency:200ms}") Duration latency) {
        this.latency = latency;
        log.info("[Sim] simulated device executor active, latency={}ms", latency.toMillis());
    }

    @Override
    public DeviceState readState(DeviceDescriptor device, String iface, Duration timeout) {
        pause(device, Stage.PRECHECK, timeout);
        if (!PORT_NAME.matcher(iface).matches()) return DeviceState.missing();
        var p = port(device.name(), iface);
        synchronized (p) {
            return new DeviceState(true, p.admin, p.oper, p.config, p.macs);
        }
    }

    @Override
    public void applyCommands(DeviceDescriptor device, List<String> commands, Duration timeout) {
        pause(device, Stage.APPLY, timeout);
        if (commands.isEmpty()) return;
        var first = commands.get(0).trim();
        if (!first.startsWith("interface ")) {
            throw new DeviceRejectedException(device.name(), "% Invalid command at '^' marker: " + first);
        }
        var iface = first.substring("interface ".length()).trim();
        if (!PORT_NAME.matcher(iface).matches()) {
            throw new DeviceRejectedException(device.name(), "% Invalid interface format: " + iface);
        }
        var p = port(device.name(), iface);
        synchronized (p) {
            for (var raw : commands.subList(1, commands.size())) {
                p.apply(device.name(), raw.trim());
            }
        }
        log.debug("[Sim] {} {} <- {} line(s)", device.name(), iface, commands.size());
    }

    /** Marks a MAC as learned on a port (demo helper: makes the port look live). */
    public void learnMac(String device, String iface, String mac) {
        var p = port(device, iface);
        synchronized (p) {
            p.macs.add(mac.toLowerCase(Locale.ROOT));
            p.oper = PortStatus.UP;
        }
    }

    private SimPort port(String device, String iface) {
        return ports.computeIfAbsent(device.toLowerCase(Locale.ROOT) + "|" + iface.toLowerCase(Locale.ROOT),
                k -> new SimPort());
    }

    private void pause(DeviceDescriptor device, Stage stage, Duration timeout) {
        if (latency.compareTo(timeout) > 0) {
            sleep(timeout, device, stage);
            throw new DeviceTimeoutException(stage, device.name(), timeout, null);
        }
        sleep(latency, device, stage);
    }

    private void sleep(Duration d, DeviceDescriptor device, Stage stage) {
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChangeCancelledException(stage, device.name(), null);
        }
    }

    private static final class SimPort {
        PortStatus admin = PortStatus.UP;
        PortStatus oper = PortStatus.DOWN;
        final Map<String, String> config = new LinkedHashMap<>(Map.of("mode", "access", "vlan", "1"));
        final Set<String> macs = new LinkedHashSet<>();

        void apply(String device, String line) {
            if (line.isEmpty()) return;
            if (line.equals("switchport") || line.equals("vxlan")) return;
            if (line.equals("no shutdown")) { admin = PortStatus.UP; return; }
            if (line.equals("shutdown")) { admin = PortStatus.DOWN; oper = PortStatus.DOWN; return; }
            if (line.startsWith("description ")) { config.put("description", line.substring(12)); return; }
            if (line.startsWith("switchport mode ")) { config.put("mode", line.substring(16)); return; }
            if (line.startsWith("switchport access vlan ")) { config.put("vlan", line.substring(23)); return; }
            if (line.startsWith("switchport trunk allowed vlan add ")) {
                config.merge("trunk_vlans", line.substring(34), (a, b) -> a + "," + b);
                return;
            }
            if (line.startsWith("switchport trunk allowed vlan ")) { config.put("trunk_vlans", line.substring(30)); return; }
            if (line.startsWith("vni ")) { config.put("vni", line.substring(4)); return; }
            if (line.startsWith("vrf member ")) { config.put("vrf", line.substring(11)); return; }
            throw new DeviceRejectedException(device, "% Invalid command at '^' marker: " + line);
        }
    }
}
