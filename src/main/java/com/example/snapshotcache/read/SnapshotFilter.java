package com.example.snapshotcache.read;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;

/**
 * Criteria over cached records, all optional and combined with AND.
 * <p>
 * Matching is a pure function of the record and the given day: nothing is fetched or
 * modified. Records without a parseable {@code dueDate} never satisfy a date criterion.
 *
 * @param status    equals the record's {@code status}, ignoring case
 * @param assignee  contained in one of the record's {@code assignees}, ignoring case
 * @param dueBefore {@code dueDate} on or before this day
 * @param dueAfter  {@code dueDate} on or after this day
 * @param overdue   whether {@code dueDate} is in the past while the record is still open
 */
public record SnapshotFilter(
        String status,
        String assignee,
        LocalDate dueBefore,
        LocalDate dueAfter,
        Boolean overdue) {

    private static final Set<String> CLOSED_STATUSES = Set.of("done", "cancelled");

    public static SnapshotFilter none() {
        return new SnapshotFilter(null, null, null, null, null);
    }

    public boolean isEmpty() {
        return isBlank(status) && isBlank(assignee) && dueBefore == null && dueAfter == null && overdue == null;
    }

    public boolean matches(JsonNode record, LocalDate today) {
        if (!isBlank(status) && !status.trim().equalsIgnoreCase(record.path("status").asText(""))) {
            return false;
        }
        if (!isBlank(assignee) && !hasAssignee(record, assignee.trim().toLowerCase(Locale.ROOT))) {
            return false;
        }
        if (dueBefore == null && dueAfter == null && overdue == null) {
            return true;
        }

        LocalDate dueDate = dueDate(record);
        if (dueBefore != null && (dueDate == null || dueDate.isAfter(dueBefore))) {
            return false;
        }
        if (dueAfter != null && (dueDate == null || dueDate.isBefore(dueAfter))) {
            return false;
        }
        return overdue == null || overdue == isOverdue(record, dueDate, today);
    }

    static boolean isOverdue(JsonNode record, LocalDate dueDate, LocalDate today) {
        if (dueDate == null || !dueDate.isBefore(today)) {
            return false;
        }
        String recordStatus = record.path("status").asText("").toLowerCase(Locale.ROOT);
        return !CLOSED_STATUSES.contains(recordStatus);
    }

    private static boolean hasAssignee(JsonNode record, String needle) {
        for (JsonNode name : record.path("assignees")) {
            if (name.asText("").toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static LocalDate dueDate(JsonNode record) {
        JsonNode value = record.path("dueDate");
        if (!value.isTextual()) {
            return null;
        }
        try {
            return LocalDate.parse(value.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
