package io.netwatch.discovery.resolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Tries each resolver in order and returns the first non-blank answer. A step that fails is
 * logged and skipped.
 */
public class ResolverChain {

    private static final Logger logger = LoggerFactory.getLogger(ResolverChain.class);

    private final String kind;
    private final List<Resolver> steps;

    public ResolverChain(String kind, List<Resolver> steps) {
        this.kind = kind;
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public Optional<String> resolve(String ip) {
        for (Resolver step : steps) {
            try {
                Optional<String> value = step.resolve(ip);
                if (value.isPresent() && !value.get().isBlank()) {
                    logger.debug("Found {} {} for {} using {}", kind, value.get(), ip, step.name());
                    return Optional.of(value.get().trim());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.debug("{} lookup for {} interrupted", kind, ip);
                return Optional.empty();
            } catch (Exception e) {
                logger.debug("{} failed for {}: {}", step.name(), ip, e.toString());
            }
        }
        logger.debug("No {} found for {}", kind, ip);
        return Optional.empty();
    }

    public List<Resolver> getSteps() {
        return steps;
    }
}
