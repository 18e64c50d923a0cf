package de.bsommerfeld.rentalprice.features.amenity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns the list-like amenity serialisations found in listing exports into
 * a set of names. Accepted shapes:
 * <ul>
 * <li>JSON array: {@code ["Wifi", "Cable TV"]}</li>
 * <li>curly-brace export: {@code {TV,"Cable TV",Wifi}}</li>
 * <li>plain comma list: {@code Wifi, Pool, Free parking}</li>
 * </ul>
 * Never throws on bad input; structural damage yields a
 * {@link AmenityParseResult.Status#MALFORMED} result instead.
 */
public class AmenityParser {

    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public AmenityParser() {
        this(new ObjectMapper());
    }

    public AmenityParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public AmenityParseResult parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return AmenityParseResult.empty();
        }
        String text = raw.trim();

        String damage = structuralDamage(text);
        if (damage != null) {
            return AmenityParseResult.malformed(damage);
        }

        if (text.startsWith("[") && text.endsWith("]")) {
            try {
                List<Object> items = mapper.readValue(text, LIST_TYPE);
                Set<String> names = new LinkedHashSet<>();
                for (Object item : items) {
                    if (item != null) {
                        addName(names, item.toString());
                    }
                }
                return AmenityParseResult.parsed(names);
            } catch (JsonProcessingException e) {
                // Python-style lists with single quotes are not JSON
                return AmenityParseResult.parsed(split(text.substring(1, text.length() - 1)));
            }
        }
        if (text.startsWith("{") && text.endsWith("}")) {
            return AmenityParseResult.parsed(split(text.substring(1, text.length() - 1)));
        }
        if (text.startsWith("[") || text.startsWith("{")) {
            return AmenityParseResult.malformed("list opened but not closed at the end");
        }
        return AmenityParseResult.parsed(split(text));
    }

    /**
     * Null when brackets, braces and quotes are balanced. A backslash inside
     * a quoted item escapes the next character, so {@code "32\" TV"} is one
     * balanced item.
     */
    private static String structuralDamage(String text) {
        int square = 0;
        int curly = 0;
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quoted) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    quoted = false;
                }
                continue;
            }
            if (c == '"') {
                quoted = true;
            } else if (c == '[') {
                square++;
            } else if (c == ']') {
                square--;
            } else if (c == '{') {
                curly++;
            } else if (c == '}') {
                curly--;
            }
            if (square < 0 || curly < 0) {
                return "closing bracket without opening bracket at " + i;
            }
        }
        if (quoted) {
            return "odd number of double quotes";
        }
        if (square != 0) {
            return "unbalanced square brackets";
        }
        if (curly != 0) {
            return "unbalanced braces";
        }
        return null;
    }

    /** Comma split that respects double quotes and backslash escapes inside them. */
    private static Set<String> split(String body) {
        Set<String> names = new LinkedHashSet<>();
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (quoted && c == '\\' && i + 1 < body.length()) {
                current.append(body.charAt(++i));
            } else if (c == '"') {
                quoted = !quoted;
                current.append(c);
            } else if (c == ',' && !quoted) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        for (String part : parts) {
            addName(names, part);
        }
        return names;
    }

    private static void addName(Set<String> names, String raw) {
        String name = raw.trim();
        while (name.length() >= 2 && (isQuote(name.charAt(0)) && name.charAt(name.length() - 1) == name.charAt(0))) {
            name = name.substring(1, name.length() - 1).trim();
        }
        if (!name.isEmpty()) {
            names.add(name);
        }
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
