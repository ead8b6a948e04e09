package com.carsales.taskservice.task.filter;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Constraints narrowing which dataset rows a task materializes.
 *
 * <p>A null field is unset and applies no constraint. {@code carBrands} may also be set to
 * an empty set, which likewise applies no constraint. Instances are built once from the
 * submitted JSON by {@link #fromJson(JsonNode)}; keys other than {@code startDate},
 * {@code endDate} and {@code carBrands} are ignored.
 */
public record FilterSpec(
    LocalDate startDate,
    LocalDate endDate,
    Set<String> carBrands
) {
    private static final FilterSpec NONE = new FilterSpec(null, null, null);
    private static final DateTimeFormatter DATE_INPUT = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
        .appendLiteral('T')
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart()
        .appendOffsetId()
        .optionalEnd()
        .optionalEnd()
        .toFormatter();

    public FilterSpec {
        carBrands = carBrands == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(carBrands));
    }

    public static FilterSpec none() {
        return NONE;
    }

    public static FilterSpec fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NONE;
        }
        if (!node.isObject()) {
            throw new InvalidFilterException("Filters must be a JSON object");
        }
        return new FilterSpec(
            parseDate(node.get("startDate"), "startDate"),
            parseDate(node.get("endDate"), "endDate"),
            parseBrands(node.get("carBrands"))
        );
    }

    public boolean hasDateConstraint() {
        return startDate != null || endDate != null;
    }

    public boolean hasBrandConstraint() {
        return carBrands != null && !carBrands.isEmpty();
    }

    public boolean isUnconstrained() {
        return !hasDateConstraint() && !hasBrandConstraint();
    }

    private static LocalDate parseDate(JsonNode value, String field) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new InvalidFilterException(field + " must be an ISO-8601 date string");
        }
        String text = value.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(text, DATE_INPUT);
        } catch (DateTimeParseException e) {
            throw new InvalidFilterException(field + " is not a valid ISO-8601 date: " + text);
        }
    }

    private static Set<String> parseBrands(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isArray()) {
            throw new InvalidFilterException("carBrands must be an array of brand names");
        }
        Set<String> brands = new LinkedHashSet<>();
        for (JsonNode brand : value) {
            if (!brand.isTextual()) {
                throw new InvalidFilterException("carBrands must contain only strings");
            }
            brands.add(brand.asText());
        }
        return brands;
    }
}
