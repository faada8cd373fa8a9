package com.example.demo.batchpdf.token;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Fixed registry of token filters: pure string to string functions looked up by name.
 */
@Slf4j
public final class TokenFilters {

    private static final List<DateTimeFormatter> DATE_INPUTS = List.of(
            DateTimeFormatter.ofPattern("uuuu-M-d").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("d/M/uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("d-M-uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("uuuu/M/d").withResolverStyle(ResolverStyle.STRICT));

    private static final DateTimeFormatter DATE_OUTPUT = DateTimeFormatter.ofPattern("dd/MM/uuuu");

    private static final Map<String, UnaryOperator<String>> REGISTRY = createRegistry();

    private TokenFilters() {
    }

    private static Map<String, UnaryOperator<String>> createRegistry() {
        Map<String, UnaryOperator<String>> filters = new LinkedHashMap<>();
        filters.put("trim", String::trim);
        filters.put("upper", s -> s.toUpperCase(Locale.ROOT));
        filters.put("lower", s -> s.toLowerCase(Locale.ROOT));
        filters.put("euros", TokenFilters::euros);
        filters.put("dmy", TokenFilters::dayMonthYear);
        return Map.copyOf(filters);
    }

    public static Optional<UnaryOperator<String>> find(String name) {
        return Optional.ofNullable(REGISTRY.get(name));
    }

    public static Set<String> names() {
        return REGISTRY.keySet();
    }

    /**
     * Applies the named filter, or returns the value unchanged for an unknown name.
     */
    public static String apply(String name, String value) {
        return find(name).map(f -> f.apply(value)).orElse(value);
    }

    /**
     * Spanish-style currency: "1234,5" or "1.234,5" becomes "1.234,50 €".
     * Input that is not a number is returned as is.
     */
    static String euros(String value) {
        String normalized = value.trim().replace(".", "").replace(",", ".");
        try {
            BigDecimal amount = new BigDecimal(normalized);
            DecimalFormatSymbols symbols = new DecimalFormatSymbols(Locale.ROOT);
            symbols.setGroupingSeparator('.');
            symbols.setDecimalSeparator(',');
            symbols.setMinusSign('-');
            DecimalFormat format = new DecimalFormat("#,##0.00", symbols);
            format.setRoundingMode(RoundingMode.HALF_EVEN);
            return format.format(amount) + " €";
        } catch (NumberFormatException e) {
            log.debug("euros filter left non-numeric value unchanged: '{}'", value);
            return value;
        }
    }

    /**
     * Normalizes a date to dd/MM/yyyy. Unrecognized input is returned as is.
     */
    static String dayMonthYear(String value) {
        String s = value.trim();
        if (s.isEmpty()) {
            return "";
        }
        return DATE_INPUTS.stream()
                .map(input -> tryParse(s, input))
                .flatMap(Optional::stream)
                .findFirst()
                .map(date -> date.format(DATE_OUTPUT))
                .orElse(s);
    }

    private static Optional<LocalDate> tryParse(String text, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDate.parse(text, format));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
