package com.offlinemap.network;

import com.offlinemap.model.NetworkState;
import java.util.function.Consumer;

/**
 * Network-class oracle supplied by the host platform.
 */
public interface NetworkMonitor {

    NetworkState currentState();

    /** Registers a callback for network changes. */
    void addListener(Consumer<NetworkState> listener);

    void removeListener(Consumer<NetworkState> listener);
}
