package com.openapi.simpleSDK.generator.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Non-fatal findings of one analysis run.
 */
public class Diagnostics {
    private static final Logger logger = LoggerFactory.getLogger(Diagnostics.class);

    private final List<AmbiguityWarning> warnings = new ArrayList<>();

    public void warn(String subject, String message) {
        warnings.add(new AmbiguityWarning(subject, message));
        logger.warn("{}: {}", subject, message);
    }

    public List<AmbiguityWarning> getWarnings() {
        return List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
