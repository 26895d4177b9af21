package org.learningjava.embbench.infrastructure.adapter.in.cli;

import org.springframework.boot.ApplicationArguments;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed access to {@code --name=value} options. Malformed values raise
 * {@link IllegalArgumentException} naming the option.
 */
final class CliOptions {

    private final ApplicationArguments args;

    CliOptions(ApplicationArguments args) {
        this.args = args;
    }

    String string(String name, String defaultValue) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) return defaultValue;
        String last = values.get(values.size() - 1);
        return last == null || last.isBlank() ? defaultValue : last.trim();
    }

    String required(String name) {
        String v = string(name, null);
        if (v == null) throw new IllegalArgumentException("--" + name + " is required");
        return v;
    }

    int integer(String name, int defaultValue) {
        String v = string(name, null);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " expects an integer, got '" + v + "'");
        }
    }

    List<Integer> intList(String name, String defaultValue) {
        String v = string(name, defaultValue);
        if (v == null) throw new IllegalArgumentException("--" + name + " is required");
        return parseIntList(name, v);
    }

    boolean flag(String name) {
        if (!args.containsOption(name)) return false;
        String v = string(name, "true");
        return !"false".equalsIgnoreCase(v);
    }

    static List<Integer> parseIntList(String name, String value) {
        List<Integer> out = new ArrayList<>();
        for (String part : value.split(",")) {
            String s = part.trim();
            if (s.isEmpty()) continue;
            try {
                out.add(Integer.parseInt(s));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--" + name + " expects comma-separated integers, got '" + value + "'");
            }
        }
        if (out.isEmpty()) throw new IllegalArgumentException("--" + name + " must list at least one value");
        return out;
    }
}
