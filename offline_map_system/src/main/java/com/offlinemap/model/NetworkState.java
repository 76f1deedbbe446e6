package com.offlinemap.model;

/**
 * Snapshot of the device's network as reported by the network observer.
 */
public class NetworkState {

    public enum NetworkType {
        WIFI,
        CELLULAR,
        NONE
    }

    private final NetworkType type;
    private final boolean connected;

    public NetworkState(NetworkType type, boolean connected) {
        this.type = type;
        this.connected = connected;
    }

    public static NetworkState wifi() { return new NetworkState(NetworkType.WIFI, true); }
    public static NetworkState cellular() { return new NetworkState(NetworkType.CELLULAR, true); }
    public static NetworkState offline() { return new NetworkState(NetworkType.NONE, false); }

    public NetworkType getType() { return type; }
    public boolean isConnected() { return connected; }

    public boolean isConnectedWifi() {
        return connected && type == NetworkType.WIFI;
    }

    @Override
    public String toString() {
        return String.format("Network[%s, connected=%s]", type, connected);
    }
}
