package com.example.filingcontacts.service.job;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Job ids look like {@code ORIGIN_20240115093000_a1b2}: project origin, UTC start
 * timestamp and a short random suffix. The origin may itself contain underscores,
 * so ids are parsed from the right.
 */
@Component
public class JobIdGenerator {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("uuuuMMddHHmmss").withResolverStyle(ResolverStyle.STRICT);
    private static final String SUFFIX_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int SUFFIX_LENGTH = 4;
    private static final Pattern TIMESTAMP_DIGITS = Pattern.compile("\\d{14}");
    private static final Pattern SUFFIX = Pattern.compile("[a-z0-9]{4}");

    private final Clock clock;
    private final Random random = new SecureRandom();

    public JobIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String generate(String projectOrigin) {
        if (projectOrigin == null || projectOrigin.isBlank()) {
            throw new IllegalArgumentException("Project origin is required for a job id");
        }
        String timestamp = LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).format(TIMESTAMP);
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(SUFFIX_ALPHABET.charAt(random.nextInt(SUFFIX_ALPHABET.length())));
        }
        return projectOrigin.trim().toUpperCase() + "_" + timestamp + "_" + suffix;
    }

    public Optional<ParsedJobId> parse(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        int suffixSeparator = jobId.lastIndexOf('_');
        if (suffixSeparator <= 0) {
            return Optional.empty();
        }
        int timestampSeparator = jobId.lastIndexOf('_', suffixSeparator - 1);
        if (timestampSeparator <= 0) {
            return Optional.empty();
        }

        String origin = jobId.substring(0, timestampSeparator);
        String timestamp = jobId.substring(timestampSeparator + 1, suffixSeparator);
        String suffix = jobId.substring(suffixSeparator + 1);
        if (!TIMESTAMP_DIGITS.matcher(timestamp).matches() || !SUFFIX.matcher(suffix).matches()) {
            return Optional.empty();
        }
        try {
            Instant startedAt = LocalDateTime.parse(timestamp, TIMESTAMP).toInstant(ZoneOffset.UTC);
            return Optional.of(new ParsedJobId(origin, startedAt, suffix));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public boolean isValid(String jobId) {
        return parse(jobId).isPresent();
    }

    @Data
    @AllArgsConstructor
    public static class ParsedJobId {
        private String projectOrigin;
        private Instant timestamp;
        private String suffix;
    }
}
