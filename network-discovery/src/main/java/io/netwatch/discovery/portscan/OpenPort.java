package io.netwatch.discovery.portscan;

import org.json.JSONObject;

public class OpenPort {
    private final int port;
    private final String protocol;

    public OpenPort(int port, String protocol) {
        this.port = port;
        this.protocol = protocol;
    }

    public int getPort() { return port; }
    public String getProtocol() { return protocol; }

    public JSONObject toJson() {
        return new JSONObject().put("port", port).put("protocol", protocol);
    }

    @Override
    public String toString() {
        return port + "/" + protocol;
    }
}
