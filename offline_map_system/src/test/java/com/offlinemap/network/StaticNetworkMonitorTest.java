package com.offlinemap.network;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.offlinemap.model.NetworkState;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;

class StaticNetworkMonitorTest {

    @Test
    void notifiesListenersAndSurvivesFailingOnes() {
        StaticNetworkMonitor monitor = new StaticNetworkMonitor(NetworkState.offline());
        List<NetworkState> seen = new ArrayList<>();
        monitor.addListener(state -> {
            throw new IllegalStateException("boom");
        });
        Consumer<NetworkState> recorder = seen::add;
        monitor.addListener(recorder);

        monitor.setState(NetworkState.wifi());
        monitor.removeListener(recorder);
        monitor.setState(NetworkState.cellular());

        assertEquals(1, seen.size());
        assertTrue(seen.get(0).isConnectedWifi());
        assertFalse(monitor.currentState().isConnectedWifi());
        assertTrue(monitor.currentState().isConnected());
    }
}
