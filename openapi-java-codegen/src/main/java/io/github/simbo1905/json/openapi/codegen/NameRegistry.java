package io.github.simbo1905.json.openapi.codegen;

import io.github.simbo1905.json.openapi.codegen.CodegenOptions.NamingStyle;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static io.github.simbo1905.json.openapi.codegen.CodegenLogging.LOG;

/// Converts raw schema, property and enum-value names into Java identifiers and
/// resolves collisions between them deterministically.
///
/// A registry is created fresh for every generation run. It records, per naming
/// scope, which raw names each identifier was allocated to; nothing survives the run.
///
/// Canonicalization splits on `_`, `-`, `.`, whitespace and camelCase boundaries,
/// capitalizes each word (all-uppercase words are title-cased), strips characters
/// outside `[A-Za-z0-9_]`, prefixes a leading digit with `_` and escapes reserved
/// words with a trailing `_`. The transform is applied until stable, so canonical
/// identifiers map to themselves.
public final class NameRegistry {

    /// Scope shared by every top-level and synthesized declaration name.
    public static final String TYPE_SCOPE = "types";

    public enum IdentifierRole {
        TYPE("UnknownType"), MEMBER("Unknown"), ENUM_MEMBER("Unknown");

        private final String fallback;

        IdentifierRole(String fallback) {
            this.fallback = fallback;
        }
    }

    /// Outcome of resolving one group of colliding raw names.
    ///
    /// @param canonicalName the identifier all raw names in the group canonicalize to
    /// @param winner        raw name that keeps the canonical identifier, or null when it was already taken
    /// @param others        differentiated names for the remaining raw names, in input order
    /// @param assigned      identifier per input position
    public record CollisionResolution(String canonicalName, String winner, List<Differentiated> others,
                                      List<String> assigned) {
        public CollisionResolution {
            others = List.copyOf(others);
            assigned = List.copyOf(assigned);
        }
    }

    public record Differentiated(String rawName, String name) {}

    private static final Pattern SPLIT_WORDS = Pattern.compile("[-_.\\s]+|(?<=[a-z])(?=[A-Z])");
    private static final Pattern LEADING_MINUS = Pattern.compile("(?:^|(?<=\\s))-(?=\\d)");
    private static final Pattern INVALID_IDENTIFIER_CHARS = Pattern.compile("[^a-zA-Z0-9_]");
    private static final int MAX_CANONICAL_PASSES = 8;

    private final Set<String> reservedWords;
    private final NamingStyle memberNaming;
    private final Map<String, Map<String, List<String>>> allocations = new LinkedHashMap<>();

    public NameRegistry(CodegenOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        this.reservedWords = options.reservedWords();
        this.memberNaming = options.memberNaming();
    }

    // ------------------------------------------------------------------
    // Canonicalization
    // ------------------------------------------------------------------

    public String toTypeName(String raw) {
        return canonicalize(raw, IdentifierRole.TYPE);
    }

    public String toMemberName(String raw) {
        return canonicalize(raw, IdentifierRole.MEMBER);
    }

    public String toEnumMemberName(String raw) {
        return canonicalize(raw, IdentifierRole.ENUM_MEMBER);
    }

    public String canonicalize(String raw, IdentifierRole role) {
        Objects.requireNonNull(role, "role must not be null");
        if (raw == null || raw.isBlank()) {
            return canonicalPass(role.fallback, role);
        }
        String input = raw;
        if (role == IdentifierRole.TYPE && input.indexOf('/') >= 0) {
            input = input.substring(input.lastIndexOf('/') + 1);
        }
        String current = canonicalPass(input, role);
        for (int i = 0; i < MAX_CANONICAL_PASSES; i++) {
            final String next = canonicalPass(current, role);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
        return current;
    }

    private String canonicalPass(String input, IdentifierRole role) {
        String result = INVALID_IDENTIFIER_CHARS.matcher(toPascalCase(input)).replaceAll("");
        if (result.isEmpty()) {
            result = role.fallback;
        }
        if (role == IdentifierRole.MEMBER && memberNaming == NamingStyle.CAMEL_CASE) {
            result = Character.toLowerCase(result.charAt(0)) + result.substring(1);
        }
        if (Character.isDigit(result.charAt(0))) {
            result = "_" + result;
        }
        return reservedWords.contains(result) ? result + "_" : result;
    }

    static String toPascalCase(String input) {
        if (input.isEmpty()) {
            return input;
        }
        String prepared = input.replace("+", "Plus");
        prepared = LEADING_MINUS.matcher(prepared).replaceAll("Minus");

        final var parts = Arrays.stream(SPLIT_WORDS.split(prepared))
                .filter(p -> !p.isEmpty())
                .toList();
        if (parts.isEmpty()) {
            return prepared;
        }

        final var sb = new StringBuilder(prepared.length());
        for (var p : parts) {
            // "USER" from "USER_STATUS" becomes "User"; mixed-case "APIResponse" keeps its acronym
            final boolean allUpper = p.chars().allMatch(Character::isUpperCase);
            final String tail = allUpper ? p.substring(1).toLowerCase(java.util.Locale.ROOT) : p.substring(1);
            sb.append(Character.toUpperCase(p.charAt(0))).append(tail);
        }
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Collision resolution
    // ------------------------------------------------------------------

    /// How close a raw name already is to its canonical form; lower is more natural.
    public static int naturalnessScore(String raw, String canonical) {
        if (raw.equals(canonical)) {
            return 0;
        }
        if (raw.equalsIgnoreCase(canonical)) {
            return 1;
        }
        final long special = raw.chars().filter(c -> !Character.isLetterOrDigit(c)).count();
        if (special > 0) {
            return 10 + (int) special;
        }
        return 2;
    }

    /// Resolves one group of raw names that share a canonical identifier.
    /// `used` holds identifiers that are already taken; it is not modified.
    public CollisionResolution resolveCollision(List<String> group, IdentifierRole role, Set<String> used) {
        Objects.requireNonNull(group, "group must not be null");
        if (group.isEmpty()) {
            throw new IllegalArgumentException("collision group must not be empty");
        }
        final String canonical = canonicalize(group.get(0), role);
        final var taken = new LinkedHashSet<>(used);

        int winnerIndex = -1;
        if (!taken.contains(canonical)) {
            int best = Integer.MAX_VALUE;
            for (int i = 0; i < group.size(); i++) {
                final int score = naturalnessScore(group.get(i), canonical);
                if (score < best) {
                    best = score;
                    winnerIndex = i;
                }
            }
            taken.add(canonical);
        }

        final var assigned = new ArrayList<String>(group.size());
        final var others = new ArrayList<Differentiated>();
        for (int i = 0; i < group.size(); i++) {
            if (i == winnerIndex) {
                assigned.add(canonical);
                continue;
            }
            final String raw = group.get(i);
            final String name = differentiate(raw, canonical, taken, role);
            taken.add(name);
            assigned.add(name);
            others.add(new Differentiated(raw, name));
        }
        final String winner = winnerIndex < 0 ? null : group.get(winnerIndex);
        return new CollisionResolution(canonical, winner, others, assigned);
    }

    /// Produces a name for `raw` that differs from `canonical` and from everything in `used`.
    String differentiate(String raw, String canonical, Set<String> used, IdentifierRole role) {
        final String expandedPrefix = expandSpecialPrefix(raw);
        if (expandedPrefix != null) {
            final String candidate = canonicalize(expandedPrefix, role);
            if (isFree(candidate, canonical, used)) return candidate;
        }

        final String expandedAll = expandAllSpecialCharacters(raw);
        if (!expandedAll.equals(raw)) {
            final String candidate = canonicalize(expandedAll, role);
            if (isFree(candidate, canonical, used)) return candidate;
        }

        final String styleSuffix = namingStyleSuffix(raw);
        if (styleSuffix != null) {
            final String candidate = canonical + styleSuffix;
            if (isFree(candidate, canonical, used)) return candidate;
        }

        for (int n = 2; n > 0; n++) {
            final String candidate = canonical + n;
            if (isFree(candidate, canonical, used)) return candidate;
        }
        throw new NameExhaustionException(raw, canonical);
    }

    private static boolean isFree(String candidate, String canonical, Set<String> used) {
        return !candidate.isEmpty() && !candidate.equals(canonical) && !used.contains(candidate);
    }

    private static String expandSpecialPrefix(String name) {
        final var sb = new StringBuilder();
        int i = 0;
        boolean anyExpanded = false;
        while (i < name.length() && !Character.isLetterOrDigit(name.charAt(i))) {
            final String word = symbolWord(name.charAt(i));
            if (word != null) {
                sb.append(word).append(' ');
                anyExpanded = true;
            }
            i++;
        }
        if (!anyExpanded) {
            return null;
        }
        return sb.append(name.substring(i)).toString();
    }

    private static String expandAllSpecialCharacters(String name) {
        final var sb = new StringBuilder(name.length() * 2);
        for (int i = 0; i < name.length(); i++) {
            final char ch = name.charAt(i);
            if (Character.isLetterOrDigit(ch)) {
                sb.append(ch);
                continue;
            }
            final String word = symbolWord(ch);
            if (word != null) {
                sb.append(' ').append(word).append(' ');
            } else {
                sb.append(' ');
            }
        }
        return sb.toString();
    }

    private static String symbolWord(char ch) {
        return switch (ch) {
            case '_' -> "Underscore";
            case '-' -> "Dash";
            case '.' -> "Dot";
            case '@' -> "At";
            case '#' -> "Hash";
            case '$' -> "Dollar";
            case '%' -> "Percent";
            case '&' -> "And";
            case '+' -> "Plus";
            case '~' -> "Tilde";
            case '!' -> "Bang";
            case '*' -> "Star";
            case '/' -> "Slash";
            case '\\' -> "Backslash";
            case ':' -> "Colon";
            case '^' -> "Caret";
            case '|' -> "Pipe";
            default -> null;
        };
    }

    static String namingStyleSuffix(String name) {
        if (name.isEmpty()) return null;
        if (name.indexOf('_') >= 0) return "SnakeCase";
        if (name.indexOf('-') >= 0) return "KebabCase";
        if (name.indexOf('.') >= 0) return "DotNotation";
        final boolean anyUpper = name.chars().anyMatch(Character::isUpperCase);
        final boolean anyLower = name.chars().anyMatch(Character::isLowerCase);
        if (Character.isLowerCase(name.charAt(0)) && anyUpper) return "CamelCase";
        if (Character.isUpperCase(name.charAt(0)) && anyLower) return "PascalCase";
        if (!anyUpper) return "Lowercase";
        if (!anyLower) return "Uppercase";
        return null;
    }

    // ------------------------------------------------------------------
    // Scoped allocation
    // ------------------------------------------------------------------

    /// Assigns identifiers to `raws` within `scope`, in input order.
    ///
    /// Raw names are grouped by canonical form; each group goes through
    /// [#resolveCollision]. Identifiers already allocated in the scope, and the
    /// canonical form of every group, are unavailable as differentiated names.
    /// The same raw name may appear more than once; each occurrence gets its own identifier.
    ///
    /// @return one identifier per input position
    public List<String> assign(String scope, List<String> raws, IdentifierRole role) {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(raws, "raws must not be null");

        final Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < raws.size(); i++) {
            groups.computeIfAbsent(canonicalize(raws.get(i), role), k -> new ArrayList<>()).add(i);
        }

        final var scopeTable = allocations.computeIfAbsent(scope, k -> new LinkedHashMap<>());
        final var used = new LinkedHashSet<>(scopeTable.keySet());
        // a group's canonical name is only available to that group
        for (var canonical : groups.keySet()) {
            if (!scopeTable.containsKey(canonical)) used.add(canonical);
        }

        final var out = new String[raws.size()];
        for (var entry : groups.entrySet()) {
            final String canonical = entry.getKey();
            final List<Integer> indices = entry.getValue();
            final List<String> group = indices.stream().map(raws::get).collect(Collectors.toList());

            final var blocked = new LinkedHashSet<>(used);
            blocked.remove(canonical);
            if (scopeTable.containsKey(canonical)) blocked.add(canonical);

            final var resolution = resolveCollision(group, role, blocked);
            for (int k = 0; k < indices.size(); k++) {
                final String name = resolution.assigned().get(k);
                out[indices.get(k)] = name;
                used.add(name);
                scopeTable.computeIfAbsent(name, n -> new ArrayList<>()).add(group.get(k));
            }
            if (indices.size() > 1 || !resolution.others().isEmpty()) {
                StructuredLog.fine(LOG, "name.collision", "scope", scope, "canonical", canonical,
                        "winner", resolution.winner(), "others", resolution.others());
            }
        }
        return Arrays.asList(out);
    }

    /// Marks `name` as taken in `scope`, e.g. for inherited members or a pre-seeded registry.
    public void reserve(String scope, String name, String raw) {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(name, "name must not be null");
        allocations.computeIfAbsent(scope, k -> new LinkedHashMap<>())
                .computeIfAbsent(name, n -> new ArrayList<>())
                .add(raw == null ? name : raw);
    }

    public boolean isAllocated(String scope, String name) {
        final var table = allocations.get(scope);
        return table != null && table.containsKey(name);
    }

    /// Identifier to originating raw names for one scope, in allocation order.
    public Map<String, List<String>> allocations(String scope) {
        final var table = allocations.get(scope);
        if (table == null) {
            return Map.of();
        }
        final Map<String, List<String>> copy = new LinkedHashMap<>();
        table.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }
}
