package com.reviewengine.core.repair;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Cuts every line longer than the limit to the limit and marks it.
 * Lossy; the cut is made regardless of what the removed text was.
 */
@Component
public class LineTruncationStage implements RepairStage {

    private static final Logger log = LoggerFactory.getLogger(LineTruncationStage.class);

    public static final int DEFAULT_MAX_LINE_LENGTH = 100;
    public static final String TRUNCATION_MARKER = " # [truncated]";

    private final int maxLineLength;

    public LineTruncationStage(
            @Value("${code-review.repair.max-line-length:100}") int maxLineLength
    ) {
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("max-line-length must be >= 1, got " + maxLineLength);
        }
        this.maxLineLength = maxLineLength;
    }

    @Override
    public String getName() {
        return "line-truncation";
    }

    @Override
    public StageResult apply(String text) {
        List<String> lines = SourceLines.split(text);
        int truncated = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.codePointCount(0, line.length()) > maxLineLength) {
                int cut = line.offsetByCodePoints(0, maxLineLength);
                lines.set(i, line.substring(0, cut) + TRUNCATION_MARKER);
                truncated++;
            }
        }
        if (truncated > 0) {
            log.info("[LineTruncation] Truncated {} lines to {} characters", truncated, maxLineLength);
        }
        return StageResult.of(text, SourceLines.join(lines));
    }
}
