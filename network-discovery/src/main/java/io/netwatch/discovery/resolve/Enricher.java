package io.netwatch.discovery.resolve;

import io.netwatch.discovery.resolve.vendor.VendorLookup;
import io.netwatch.registry.model.ScanObservation;

import java.util.Optional;

public class Enricher {

    public static final String SOURCE = "scanner";

    private final ResolverChain macChain;
    private final ResolverChain hostnameChain;
    private final VendorLookup vendorLookup;

    public Enricher(ResolverChain macChain, ResolverChain hostnameChain, VendorLookup vendorLookup) {
        this.macChain = macChain;
        this.hostnameChain = hostnameChain;
        this.vendorLookup = vendorLookup;
    }

    public ScanObservation enrich(ScanObservation observation) {
        String ip = observation.getIp();

        Optional<String> mac = macChain.resolve(ip);
        if (mac.isPresent()) {
            observation.withMac(mac.get());
            vendorLookup.lookup(mac.get()).ifPresent(vendor -> observation.withVendor(vendor, SOURCE));
        }

        hostnameChain.resolve(ip).ifPresent(hostname -> observation.withHostname(hostname, SOURCE));
        return observation;
    }
}
