package com.company.uptime.probe;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort extraction of the expiry date (and registrar) from a raw WHOIS response.
 * Registries disagree on both the label and the date format.
 */
@Component
@Slf4j
public class WhoisExpiryParser {

    private static final List<Pattern> EXPIRY_PATTERNS = List.of(
            Pattern.compile("^\\s*Registry Expiry Date:\\s*(.+)$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE),
            Pattern.compile("^\\s*Registrar Registration Expiration Date:\\s*(.+)$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE),
            Pattern.compile("^\\s*Expiry Date:\\s*(.+)$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE),
            Pattern.compile("^\\s*Expiration Date:\\s*(.+)$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE),
            Pattern.compile("^\\s*paid-till:\\s*(.+)$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE),
            Pattern.compile("^\\s*expires:\\s*(.+)$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE)
    );

    private static final Pattern REGISTRAR_PATTERN =
            Pattern.compile("^\\s*Registrar:\\s*(.+)$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private static final List<DateTimeFormatter> OFFSET_DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssXXX")
    );

    private static final List<DateTimeFormatter> LOCAL_DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy.MM.dd HH:mm:ss")
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy.MM.dd"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("dd-MMM-yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("dd.MM.yyyy")
    );

    public Optional<WhoisRecord> parse(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : EXPIRY_PATTERNS) {
            Matcher matcher = pattern.matcher(response);
            while (matcher.find()) {
                Instant expiry = parseDate(matcher.group(1).trim());
                if (expiry != null) {
                    return Optional.of(new WhoisRecord(expiry, findRegistrar(response)));
                }
            }
        }
        return Optional.empty();
    }

    Instant parseDate(String raw) {
        String value = raw.trim();
        for (DateTimeFormatter format : OFFSET_DATE_TIME_FORMATS) {
            Instant parsed = tryParse(() -> OffsetDateTime.parse(value, format).toInstant());
            if (parsed != null) {
                return parsed;
            }
        }
        for (DateTimeFormatter format : LOCAL_DATE_TIME_FORMATS) {
            Instant parsed = tryParse(() -> LocalDateTime.parse(value, format).toInstant(ZoneOffset.UTC));
            if (parsed != null) {
                return parsed;
            }
        }
        // Date-only values, possibly followed by a timezone label
        String datePart = value.split("\\s+")[0];
        for (DateTimeFormatter format : DATE_FORMATS) {
            Instant parsed = tryParse(() -> LocalDate.parse(datePart, format).atStartOfDay(ZoneOffset.UTC).toInstant());
            if (parsed != null) {
                return parsed;
            }
        }
        log.debug("Unrecognized WHOIS date: {}", raw);
        return null;
    }

    private static Instant tryParse(Supplier<Instant> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private String findRegistrar(String response) {
        Matcher matcher = REGISTRAR_PATTERN.matcher(response);
        return matcher.find() ? matcher.group(1).trim() : null;
    }
}
