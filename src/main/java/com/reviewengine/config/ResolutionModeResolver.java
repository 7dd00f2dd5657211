package com.reviewengine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class ResolutionModeResolver {

    private static final Logger log = LoggerFactory.getLogger(ResolutionModeResolver.class);

    private final ResolutionMode mode;

    public ResolutionModeResolver(
        @Value("${code-review.scope.resolution-mode:ordered}") String mode
    ) {
        this.mode = parse(mode);
        log.info("[ResolutionModeResolver] Scope resolution mode: {}", this.mode);
    }

    /**
     * Accepts {@code ordered}, {@code two-phase} or {@code two_phase}, in any case.
     */
    static ResolutionMode parse(String value) {
        if (value == null || value.isBlank()) {
            return ResolutionMode.ORDERED;
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        return ResolutionMode.valueOf(normalized);
    }

    public boolean isOrdered() {
        return mode == ResolutionMode.ORDERED;
    }

    public boolean isTwoPhase() {
        return mode == ResolutionMode.TWO_PHASE;
    }

    public ResolutionMode getMode() {
        return mode;
    }
}
