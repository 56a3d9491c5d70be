package io.netwatch.discovery.probe;

@FunctionalInterface
public interface Prober {

    ProbeResult probe(String ip);
}
