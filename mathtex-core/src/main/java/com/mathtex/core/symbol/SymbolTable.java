package com.mathtex.core.symbol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable mapping from codepoints to markup commands, and from symbol names to
 * codepoints.
 *
 * <p>The {@link #standard() standard table} is loaded once, on first use, from the
 * classpath resource {@value #STANDARD_RESOURCE} and shared by every conversion. Being
 * immutable, a table can be used from any number of threads without coordination.
 *
 * <p>When several entries share a codepoint, the first one wins, both for
 * {@link #lookup(int)} and, among accent-class entries, for {@link #lookupAccent(int)}.
 *
 * <p><b>Symbol file format:</b>
 * <pre>{@code
 * symbols:
 *   - { codepoint: "U+2192", command: rightarrow, class: relation, names: [arrow.r] }
 *   - { codepoint: "U+0303", command: tilde, class: accent }
 *   - { codepoint: "U+211D", names: [RR] }   # name only, rendered as the raw character
 * }</pre>
 */
public final class SymbolTable {

    private static final Logger log = LoggerFactory.getLogger(SymbolTable.class);

    /** Classpath location of the standard table. */
    public static final String STANDARD_RESOURCE = "mathtex/symbols.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String CODEPOINT_PREFIX = "U+";

    private final Map<Integer, MathSymbol> byCodepoint;
    private final Map<Integer, MathSymbol> accents;
    private final SortedMap<String, Integer> byName;

    private SymbolTable(Builder builder) {
        this.byCodepoint = Map.copyOf(builder.byCodepoint);
        this.accents = Map.copyOf(builder.accents);
        this.byName = Collections.unmodifiableSortedMap(new TreeMap<>(builder.byName));
    }

    /**
     * Returns the process-wide standard table.
     *
     * @return the standard table
     * @throws UncheckedIOException if the bundled resource cannot be read
     */
    public static SymbolTable standard() {
        return StandardHolder.STANDARD;
    }

    /**
     * Creates an empty builder.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads a symbol file.
     *
     * @param path YAML symbol file
     * @return the table described by the file
     * @throws IOException if the file cannot be read or parsed
     * @throws IllegalArgumentException if an entry is malformed
     */
    public static SymbolTable load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        }
    }

    /**
     * Reads a symbol file from a stream.
     *
     * @param in YAML content
     * @param origin name of the content, used in error messages
     * @return the table described by the content
     * @throws IOException if the content cannot be parsed
     * @throws IllegalArgumentException if an entry is malformed
     */
    public static SymbolTable read(InputStream in, String origin) throws IOException {
        SymbolFile file = YAML_MAPPER.readValue(in, SymbolFile.class);
        Builder builder = builder();
        if (file == null || file.symbols() == null) {
            log.warn("Symbol file {} declares no symbols", origin);
            return builder.build();
        }

        int index = 0;
        for (SymbolEntry entry : file.symbols()) {
            try {
                builder.entry(entry);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                    origin + ": invalid symbol entry #" + index + ": " + e.getMessage(), e);
            }
            index++;
        }

        SymbolTable table = builder.build();
        log.debug("Loaded {} symbols and {} names from {}", table.byCodepoint.size(), table.byName.size(), origin);
        return table;
    }

    /**
     * Looks up the entry for a codepoint.
     *
     * @param codepoint Unicode codepoint
     * @return the first entry declared for the codepoint, if any
     */
    public Optional<MathSymbol> lookup(int codepoint) {
        return Optional.ofNullable(byCodepoint.get(codepoint));
    }

    /**
     * Looks up the accent-class entry for a codepoint.
     *
     * @param codepoint canonical combining accent codepoint
     * @return the first accent-class entry declared for the codepoint, if any
     */
    public Optional<MathSymbol> lookupAccent(int codepoint) {
        return Optional.ofNullable(accents.get(codepoint));
    }

    /**
     * Resolves a symbol name.
     *
     * @param name identifier such as {@code arrow.r}
     * @return the codepoint the name stands for, if known
     */
    public OptionalInt resolve(String name) {
        Integer codepoint = byName.get(name);
        return codepoint == null ? OptionalInt.empty() : OptionalInt.of(codepoint);
    }

    /**
     * Returns all symbol names, sorted.
     *
     * @return unmodifiable name to codepoint map
     */
    public SortedMap<String, Integer> names() {
        return byName;
    }

    /**
     * Returns the number of codepoints with a markup command.
     *
     * @return entry count
     */
    public int size() {
        return byCodepoint.size();
    }

    /**
     * Layers another table under this one. Entries and names of this table take
     * precedence; the other table only fills in what is missing.
     *
     * @param other table to add
     * @return combined table
     */
    public SymbolTable extendedWith(SymbolTable other) {
        Objects.requireNonNull(other, "other must not be null");
        Builder builder = builder();
        builder.addAll(this);
        builder.addAll(other);
        return builder.build();
    }

    /**
     * Formats a codepoint in {@code U+XXXX} notation.
     *
     * @param codepoint Unicode codepoint
     * @return formatted codepoint
     */
    public static String formatCodepoint(int codepoint) {
        return String.format("U+%04X", codepoint);
    }

    /**
     * Parses a codepoint in {@code U+XXXX} notation.
     *
     * @param text formatted codepoint
     * @return the codepoint
     * @throws IllegalArgumentException if the text is not a valid codepoint
     */
    public static int parseCodepoint(String text) {
        if (text == null || !text.startsWith(CODEPOINT_PREFIX)) {
            throw new IllegalArgumentException("codepoint must look like U+XXXX, got " + text);
        }
        int codepoint;
        try {
            codepoint = Integer.parseInt(text.substring(CODEPOINT_PREFIX.length()), 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("codepoint must look like U+XXXX, got " + text, e);
        }
        if (!Character.isValidCodePoint(codepoint)) {
            throw new IllegalArgumentException("codepoint out of range: " + text);
        }
        return codepoint;
    }

    /**
     * Accumulates entries; the first entry for a codepoint or name wins.
     */
    public static final class Builder {

        private final Map<Integer, MathSymbol> byCodepoint = new HashMap<>();
        private final Map<Integer, MathSymbol> accents = new HashMap<>();
        private final Map<String, Integer> byName = new HashMap<>();

        private Builder() {
        }

        /**
         * Adds a symbol with a markup command.
         *
         * @param codepoint Unicode codepoint
         * @param command markup command name, without backslash
         * @param type math class
         * @param names identifiers resolving to the codepoint
         * @return this builder
         */
        public Builder symbol(int codepoint, String command, AtomType type, String... names) {
            MathSymbol symbol = new MathSymbol(codepoint, command, type);
            byCodepoint.putIfAbsent(codepoint, symbol);
            if (symbol.isAccent()) {
                accents.putIfAbsent(codepoint, symbol);
            }
            return names(codepoint, names);
        }

        /**
         * Adds identifiers for a codepoint without a markup command.
         *
         * @param codepoint Unicode codepoint
         * @param names identifiers resolving to the codepoint
         * @return this builder
         */
        public Builder names(int codepoint, String... names) {
            if (!Character.isValidCodePoint(codepoint)) {
                throw new IllegalArgumentException("Invalid codepoint: " + codepoint);
            }
            for (String name : names) {
                if (name == null || name.isBlank()) {
                    throw new IllegalArgumentException("symbol names must not be blank");
                }
                byName.putIfAbsent(name, codepoint);
            }
            return this;
        }

        /**
         * Builds the immutable table.
         *
         * @return the table
         */
        public SymbolTable build() {
            return new SymbolTable(this);
        }

        private void entry(SymbolEntry entry) {
            if (entry == null) {
                throw new IllegalArgumentException("entry must not be empty");
            }
            int codepoint = parseCodepoint(entry.codepoint());
            String[] names = entry.names() == null ? new String[0] : entry.names().toArray(String[]::new);
            if (entry.command() == null) {
                names(codepoint, names);
            } else {
                AtomType type = AtomType.fromId(entry.atomClass() == null ? "ordinary" : entry.atomClass());
                symbol(codepoint, entry.command(), type, names);
            }
        }

        private void addAll(SymbolTable table) {
            table.byCodepoint.forEach(byCodepoint::putIfAbsent);
            table.accents.forEach(accents::putIfAbsent);
            table.byName.forEach(byName::putIfAbsent);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SymbolFile(
        @JsonProperty("symbols") List<SymbolEntry> symbols
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SymbolEntry(
        @JsonProperty("codepoint") String codepoint,
        @JsonProperty("command") String command,
        @JsonProperty("class") String atomClass,
        @JsonProperty("names") List<String> names
    ) {}

    private static final class StandardHolder {

        private static final SymbolTable STANDARD = loadStandard();

        private static SymbolTable loadStandard() {
            ClassLoader loader = SymbolTable.class.getClassLoader();
            try (InputStream in = loader.getResourceAsStream(STANDARD_RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Missing classpath resource: " + STANDARD_RESOURCE);
                }
                return read(in, STANDARD_RESOURCE);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load " + STANDARD_RESOURCE, e);
            }
        }
    }
}
