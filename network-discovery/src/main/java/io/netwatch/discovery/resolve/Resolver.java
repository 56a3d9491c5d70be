package io.netwatch.discovery.resolve;

import java.util.Optional;

public interface Resolver {

    String name();

    Optional<String> resolve(String ip) throws Exception;
}
