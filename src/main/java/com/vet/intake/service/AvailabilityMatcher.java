package com.vet.intake.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.vet.intake.domain.NoOfferReason;
import com.vet.intake.domain.SlotCandidate;
import com.vet.intake.domain.SlotOffer;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns whatever the availability search returned into at most three slots: the first
 * usable candidate wins, the next two are alternates. The backend's order is kept.
 *
 * <p>The backend's timestamp is kept as the slot's {@code iso}; only the date, time and
 * display text are rounded to five minutes.
 *
 * <p>Accepted shapes: {@code {candidates:[...]}}, {@code {slots:[...]}},
 * {@code {winner, alternates}} and a bare array.
 */
@Component
public class AvailabilityMatcher {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityMatcher.class);

    static final int MAX_SLOTS = 1 + SlotOffer.MAX_ALTERNATES;

    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("EEE, MMM d 'at' h:mm a", Locale.US);
    private static final DateTimeFormatter LOCAL_ISO = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    private static final LocalTime DEFAULT_TIME = LocalTime.NOON;

    public SlotOffer match(JsonNode raw) {
        List<SlotCandidate> slots = new ArrayList<>();
        for (JsonNode entry : entries(raw)) {
            if (slots.size() == MAX_SLOTS) break;
            SlotCandidate candidate = toCandidate(entry);
            if (candidate != null) slots.add(candidate);
        }
        if (slots.isEmpty()) {
            return SlotOffer.none(NoOfferReason.NONE_FOUND);
        }
        return SlotOffer.of(slots.get(0), slots.subList(1, slots.size()));
    }

    private List<JsonNode> entries(JsonNode raw) {
        List<JsonNode> entries = new ArrayList<>();
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return entries;
        }
        if (raw.isArray()) {
            raw.forEach(entries::add);
        } else if (raw.path("candidates").isArray()) {
            raw.get("candidates").forEach(entries::add);
        } else if (raw.path("slots").isArray() && raw.get("slots").size() > 0) {
            raw.get("slots").forEach(entries::add);
        } else if (raw.hasNonNull("winner") || raw.path("alternates").isArray()) {
            if (raw.hasNonNull("winner")) entries.add(raw.get("winner"));
            raw.path("alternates").forEach(entries::add);
        }
        return entries;
    }

    private SlotCandidate toCandidate(JsonNode entry) {
        if (entry == null || !entry.isObject()) return null;
        String rawIso = firstText(entry, "suggestedStartIso", "iso");
        String rawDate = firstText(entry, "date");

        Temporal start = rawIso == null ? null : parseTimestamp(rawIso);
        if (start == null && rawDate == null) {
            log.debug("Skipping availability entry without timestamp or date: {}", entry);
            return null;
        }

        LocalDateTime local;
        String iso;
        if (start instanceof OffsetDateTime) {
            local = roundToFiveMinutes((OffsetDateTime) start).toLocalDateTime();
            iso = rawIso;
        } else if (start instanceof LocalDateTime) {
            local = roundToFiveMinutes((LocalDateTime) start);
            iso = rawIso;
        } else {
            LocalDate date;
            try {
                date = LocalDate.parse(rawDate);
            } catch (DateTimeParseException e) {
                log.debug("Skipping availability entry with unreadable date {}", rawDate);
                return null;
            }
            local = LocalDateTime.of(date, parseTime(firstText(entry, "time")));
            iso = LOCAL_ISO.format(local);
        }

        LocalDate date = local.toLocalDate();
        if (rawDate != null) {
            try {
                date = LocalDate.parse(rawDate);
            } catch (DateTimeParseException e) {
                log.debug("Ignoring unreadable date {} on timestamped entry", rawDate);
            }
        }
        String display = StringUtils.defaultIfBlank(firstText(entry, "display"), DISPLAY.format(local));
        return new SlotCandidate(date, local.toLocalTime(), iso, display,
                firstText(entry, "doctorId", "providerId"),
                firstText(entry, "doctorName", "providerName"));
    }

    private static Temporal parseTimestamp(String value) {
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value);
            } catch (DateTimeParseException ignored) {
                log.debug("Unreadable slot timestamp {}", value);
                return null;
            }
        }
    }

    private static LocalTime parseTime(String value) {
        if (value == null) return DEFAULT_TIME;
        try {
            return LocalTime.parse(value);
        } catch (DateTimeParseException e) {
            return DEFAULT_TIME;
        }
    }

    static OffsetDateTime roundToFiveMinutes(OffsetDateTime value) {
        OffsetDateTime truncated = value.truncatedTo(ChronoUnit.MINUTES);
        return truncated.plusMinutes(roundingDelta(truncated.getMinute()));
    }

    static LocalDateTime roundToFiveMinutes(LocalDateTime value) {
        LocalDateTime truncated = value.truncatedTo(ChronoUnit.MINUTES);
        return truncated.plusMinutes(roundingDelta(truncated.getMinute()));
    }

    /** Half-up to the nearest multiple of five; seconds are dropped first. */
    private static long roundingDelta(int minute) {
        int rounded = Math.round(minute / 5.0f) * 5;
        return rounded - minute;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && StringUtils.isNotBlank(value.asText())) {
                return value.asText().trim();
            }
        }
        return null;
    }
}
