package io.netwatch.discovery.resolve;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResolverChainTest {

    private static Resolver step(String name, List<String> calls, ThrowingAnswer answer) {
        return new Resolver() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<String> resolve(String ip) throws Exception {
                calls.add(name);
                return answer.get();
            }
        };
    }

    private interface ThrowingAnswer {
        Optional<String> get() throws Exception;
    }

    @Test
    void failingAndEmptyStepsFallThrough() {
        List<String> calls = new ArrayList<>();
        ResolverChain chain = new ResolverChain("hostname", List.of(
            step("broken", calls, () -> {
                throw new IOException("no such binary");
            }),
            step("empty", calls, Optional::empty),
            step("blank", calls, () -> Optional.of("  ")),
            step("answer", calls, () -> Optional.of(" nas.lan ")),
            step("never", calls, () -> Optional.of("other"))));

        assertEquals(Optional.of("nas.lan"), chain.resolve("192.168.1.5"));
        assertEquals(List.of("broken", "empty", "blank", "answer"), calls);
    }

    @Test
    void nothingFound() {
        List<String> calls = new ArrayList<>();
        ResolverChain chain = new ResolverChain("MAC", List.of(
            step("a", calls, Optional::empty),
            step("b", calls, () -> {
                throw new IllegalStateException("parse error");
            })));

        assertTrue(chain.resolve("192.168.1.5").isEmpty());
        assertEquals(2, calls.size());
    }

    @Test
    void interruptStopsTheChain() {
        List<String> calls = new ArrayList<>();
        ResolverChain chain = new ResolverChain("MAC", List.of(
            step("a", calls, () -> {
                throw new InterruptedException();
            }),
            step("b", calls, () -> Optional.of("aa:bb:cc:dd:ee:ff"))));

        assertTrue(chain.resolve("192.168.1.5").isEmpty());
        assertEquals(List.of("a"), calls);
        assertTrue(Thread.interrupted());
    }
}
