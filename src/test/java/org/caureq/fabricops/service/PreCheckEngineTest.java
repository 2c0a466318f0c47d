package org.caureq.fabricops.service;

import org.caureq.fabricops.Fixtures;
import org.caureq.fabricops.domain.DeviceDescriptor;
import org.caureq.fabricops.service.device.DeviceExecutor;
import org.caureq.fabricops.service.error.DeviceNotFoundException;
import org.caureq.fabricops.service.error.DeviceTimeoutException;
import org.caureq.fabricops.service.error.DeviceUnreachableException;
import org.caureq.fabricops.service.error.Stage;
import org.caureq.fabricops.service.inventory.InventorySource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PreCheckEngineTest {
    @Mock InventorySource inventory;
    @Mock DeviceExecutor devices;

    private final DeviceDescriptor leaf = Fixtures.device("leaf-01");
    private PreCheckEngine engine;

    @BeforeEach
    void setUp() {
        engine = new PreCheckEngine(inventory, devices, Fixtures.props());
    }

    @Test
    void idlePortIsSafeToConfigure() {
        when(inventory.resolve("leaf-01")).thenReturn(leaf);
        when(devices.readState(leaf, "Eth1/1", Duration.ofSeconds(1))).thenReturn(Fixtures.idlePort());

        var result = engine.check(Fixtures.serverLink());

        assertThat(result.safe()).isTrue();
        assertThat(result.portExists()).isTrue();
        assertThat(result.device()).isEqualTo("leaf-01");
        assertThat(result.currentConfig()).containsEntry("vlan", "1");
        assertThat(result.recommendations()).contains("No MAC addresses learned - safe to reconfigure");
    }

    @Test
    void livePortIsUnsafeForABarePreCheck() {
        when(inventory.resolve("leaf-01")).thenReturn(leaf);
        when(devices.readState(any(), anyString(), any())).thenReturn(Fixtures.livePort("aa:bb:cc:dd:ee:ff"));

        var result = engine.check("leaf-01", "Eth1/1");

        assertThat(result.safe()).isFalse();
        assertThat(result.learnedMacAddresses()).containsExactly("aa:bb:cc:dd:ee:ff");
    }

    @Test
    void deviceFailuresPropagate() {
        when(inventory.resolve("leaf-01")).thenReturn(leaf);
        when(devices.readState(any(), anyString(), any()))
                .thenThrow(new DeviceUnreachableException(Stage.PRECHECK, "leaf-01", "connection refused", null))
                .thenThrow(new DeviceTimeoutException(Stage.PRECHECK, "leaf-01", Duration.ofSeconds(1), null));

        assertThatThrownBy(() -> engine.check("leaf-01", "Eth1/1")).isInstanceOf(DeviceUnreachableException.class);
        assertThatThrownBy(() -> engine.check("leaf-01", "Eth1/1")).isInstanceOf(DeviceTimeoutException.class);
    }

    @Test
    void unknownDeviceIsNeverContacted() {
        when(inventory.resolve("leaf-99")).thenThrow(new DeviceNotFoundException("leaf-99"));

        assertThatThrownBy(() -> engine.check("leaf-99", "Eth1/1")).isInstanceOf(DeviceNotFoundException.class);
        verifyNoInteractions(devices);
    }
}
