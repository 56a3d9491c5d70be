package io.netwatch.discovery.resolve.hostname;

import io.netwatch.discovery.resolve.Resolver;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * PTR lookup through the JVM resolver, bounded by a timeout since
 * {@link InetAddress#getCanonicalHostName()} has none of its own. A timed-out lookup cannot be
 * interrupted and keeps its thread until the resolver returns; the pool is fixed so at most
 * {@link #LOOKUP_THREADS} can be stuck at once.
 */
public class ReverseDns implements Resolver {

    @FunctionalInterface
    public interface Lookup {
        String reverse(String ip) throws UnknownHostException;
    }

    static final int LOOKUP_THREADS = 8;

    private static final ThreadPoolExecutor LOOKUPS = (ThreadPoolExecutor) Executors.newFixedThreadPool(LOOKUP_THREADS, r -> {
        Thread t = new Thread(r, "reverse-dns");
        t.setDaemon(true);
        return t;
    });

    private final Lookup lookup;
    private final Duration timeout;

    public ReverseDns(Duration timeout) {
        this(ip -> InetAddress.getByName(ip).getCanonicalHostName(), timeout);
    }

    public ReverseDns(Lookup lookup, Duration timeout) {
        this.lookup = lookup;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "reverse DNS";
    }

    @Override
    public Optional<String> resolve(String ip) throws Exception {
        CompletableFuture<String> pending = CompletableFuture.supplyAsync(() -> {
            try {
                return lookup.reverse(ip);
            } catch (UnknownHostException e) {
                return null;
            }
        }, LOOKUPS);

        String hostname;
        try {
            hostname = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw e;
        }
        return accept(ip, hostname);
    }

    static int lookupThreadCount() {
        return LOOKUPS.getPoolSize();
    }

    /** The JVM answers with the address itself when there is no PTR record. */
    static Optional<String> accept(String ip, String hostname) {
        if (hostname == null || hostname.isBlank() || hostname.equals(ip) || hostname.contains("in-addr.arpa")) {
            return Optional.empty();
        }
        return Optional.of(hostname.trim());
    }
}
