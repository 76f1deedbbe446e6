package com.offlinemap.network;

import com.offlinemap.model.NetworkState;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Network monitor whose state is set by the host (or by a test) instead of observed.
 */
public class StaticNetworkMonitor implements NetworkMonitor {
    private static final Logger LOGGER = LoggerFactory.getLogger(StaticNetworkMonitor.class);

    private final List<Consumer<NetworkState>> listeners = new CopyOnWriteArrayList<>();
    private volatile NetworkState state;

    public StaticNetworkMonitor(NetworkState initial) {
        this.state = initial;
    }

    @Override
    public NetworkState currentState() {
        return state;
    }

    /** Changes the reported state and notifies listeners. */
    public void setState(NetworkState newState) {
        this.state = newState;
        for (Consumer<NetworkState> listener : listeners) {
            try {
                listener.accept(newState);
            } catch (RuntimeException e) {
                LOGGER.error("Network listener failed: {}", e.getMessage(), e);
            }
        }
    }

    @Override
    public void addListener(Consumer<NetworkState> listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(Consumer<NetworkState> listener) {
        listeners.remove(listener);
    }
}
