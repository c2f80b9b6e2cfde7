package io.github.flameyossnowy.tabula.sql.internals.mapping;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Table and column naming conventions.
 *
 * <ul>
 *     <li>table: {@code tableize("inhabitedPlanet") -> "inhabited_planets"}</li>
 *     <li>column: {@code underscore("firstName") -> "first_name"}</li>
 *     <li>key column: {@code foreignKey("homePlanet") -> "home_planet_id"}</li>
 * </ul>
 */
public final class NamingUtil {
    private static final Pattern ACRONYM_BOUNDARY = Pattern.compile("([A-Z]+)([A-Z][a-z])");
    private static final Pattern WORD_BOUNDARY = Pattern.compile("([a-z\\d])([A-Z])");

    private static final Set<String> UNCOUNTABLE = Set.of(
        "equipment", "information", "rice", "money", "species", "series", "fish", "sheep", "jeans", "police", "news"
    );

    private static final Map<String, String> IRREGULAR = Map.of(
        "person", "people",
        "man", "men",
        "woman", "women",
        "child", "children",
        "sex", "sexes",
        "move", "moves",
        "zombie", "zombies",
        "foot", "feet",
        "tooth", "teeth",
        "goose", "geese"
    );

    // First match wins.
    private static final List<Rule> PLURAL_RULES = List.of(
        new Rule("(quiz)$", "$1zes"),
        new Rule("^(oxen)$", "$1"),
        new Rule("^(ox)$", "$1en"),
        new Rule("^(m|l)ouse$", "$1ice"),
        new Rule("(matr|vert|ind)(?:ix|ex)$", "$1ices"),
        new Rule("(x|ch|ss|sh)$", "$1es"),
        new Rule("([^aeiouy]|qu)y$", "$1ies"),
        new Rule("(hive)$", "$1s"),
        new Rule("(?:([^f])fe|([lr])f)$", "$1$2ves"),
        new Rule("sis$", "ses"),
        new Rule("([ti])a$", "$1a"),
        new Rule("([ti])um$", "$1a"),
        new Rule("(buffal|tomat)o$", "$1oes"),
        new Rule("(bu)s$", "$1ses"),
        new Rule("(alias|status)$", "$1es"),
        new Rule("(octop|vir)i$", "$1i"),
        new Rule("(octop|vir)us$", "$1i"),
        new Rule("^(ax|test)is$", "$1es"),
        new Rule("s$", "s"),
        new Rule("$", "s")
    );

    private NamingUtil() {
        throw new AssertionError("No instances");
    }

    /**
     * Lower snake case: {@code "homePlanet" -> "home_planet"}, {@code "HTTPServer" -> "http_server"}.
     */
    public static @NotNull String underscore(@NotNull String word) {
        String result = ACRONYM_BOUNDARY.matcher(word).replaceAll("$1_$2");
        result = WORD_BOUNDARY.matcher(result).replaceAll("$1_$2");
        return result.replace('-', '_').toLowerCase(Locale.ROOT);
    }

    /**
     * Plural of the last word of an underscored name.
     */
    public static @NotNull String pluralize(@NotNull String word) {
        if (word.isEmpty()) return word;

        int split = word.lastIndexOf('_') + 1;
        String prefix = word.substring(0, split);
        String last = word.substring(split);
        String lower = last.toLowerCase(Locale.ROOT);

        if (UNCOUNTABLE.contains(lower)) return word;

        String irregular = IRREGULAR.get(lower);
        if (irregular != null) return prefix + irregular;

        for (Rule rule : PLURAL_RULES) {
            Matcher matcher = rule.pattern().matcher(last);
            if (matcher.find()) {
                return prefix + matcher.replaceFirst(rule.replacement());
            }
        }
        return word;
    }

    public static @NotNull String tableize(@NotNull String type) {
        return pluralize(underscore(type));
    }

    public static @NotNull String foreignKey(@NotNull String property) {
        return underscore(property) + "_id";
    }

    /**
     * Join table shared by two collection relationships that are each other's inverse. The name
     * does not depend on which side asks for it.
     */
    public static @NotNull String joinTable(@NotNull String relationship, @NotNull String inverse) {
        String left = tableize(relationship);
        String right = tableize(inverse);
        return left.compareTo(right) <= 0 ? left + '_' + right : right + '_' + left;
    }

    private record Rule(Pattern pattern, String replacement) {
        Rule(String regex, String replacement) {
            this(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement);
        }
    }
}
