package com.mathtex.core.reader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.mathtex.core.error.TexifyException;
import com.mathtex.core.model.Accent;
import com.mathtex.core.model.AlignPoint;
import com.mathtex.core.model.Atom;
import com.mathtex.core.model.Binomial;
import com.mathtex.core.model.Ceil;
import com.mathtex.core.model.Floor;
import com.mathtex.core.model.ForcedBreak;
import com.mathtex.core.model.Formula;
import com.mathtex.core.model.Fraction;
import com.mathtex.core.model.LiteralText;
import com.mathtex.core.model.MathNode;
import com.mathtex.core.model.Script;
import com.mathtex.core.model.Sequence;
import com.mathtex.core.model.SourceSpan;
import com.mathtex.core.model.Space;
import com.mathtex.core.model.Sqrt;
import com.mathtex.core.model.Symbol;
import com.mathtex.core.symbol.AccentNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds formula trees from JSON or YAML documents.
 *
 * <p>A string is an atom and an array is a sequence. Every other node is an object
 * with a {@code type} member:
 * <pre>{@code
 * type: formula
 * block: true
 * children:
 *   - type: frac
 *     num: ["(", x, "+", "1", ")"]
 *     denom: "2"
 *   - { type: space }
 *   - { type: accent, base: a, accent: "~" }
 *   - { type: script, base: a, sub: i, sup: "2" }
 *   - { type: symbol, name: arrow.r }
 *   - { type: text, text: "if" }
 * }</pre>
 *
 * <p>Every node is tagged with a {@link SourceSpan} holding the JSON Pointer of the
 * node inside the document. Structural problems fail with a
 * {@link FormulaFormatException}; accent operands are validated as the nodes are built
 * and fail with the core's {@link TexifyException}s.
 */
public class FormulaReader {

    private static final Logger log = LoggerFactory.getLogger(FormulaReader.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final String TYPE = "type";

    private final AccentNormalizer normalizer;

    public FormulaReader() {
        this(AccentNormalizer.standard());
    }

    public FormulaReader(AccentNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
    }

    /**
     * Reads a formula document, choosing JSON or YAML by file extension.
     *
     * @param path {@code .json}, {@code .yaml} or {@code .yml} file
     * @return the formula
     * @throws IOException if the file cannot be read or is not a valid formula document
     * @throws TexifyException if an accent operand is invalid
     */
    public Formula read(Path path) throws IOException, TexifyException {
        String source = path.getFileName().toString();
        String lower = source.toLowerCase(Locale.ROOT);

        ObjectMapper mapper;
        if (lower.endsWith(".json")) {
            mapper = JSON_MAPPER;
        } else if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            mapper = YAML_MAPPER;
        } else {
            throw new FormulaFormatException("unsupported document type, expected .json, .yaml or .yml",
                SourceSpan.root(source));
        }

        log.debug("Reading formula document: {}", path);
        return read(mapper.readTree(path.toFile()), source);
    }

    /**
     * Reads a JSON formula document.
     *
     * @param json document content
     * @param source document name used in locations
     * @return the formula
     * @throws IOException if the content is not a valid formula document
     * @throws TexifyException if an accent operand is invalid
     */
    public Formula readJson(String json, String source) throws IOException, TexifyException {
        return read(JSON_MAPPER.readTree(json), source);
    }

    /**
     * Reads a YAML formula document.
     *
     * @param yaml document content
     * @param source document name used in locations
     * @return the formula
     * @throws IOException if the content is not a valid formula document
     * @throws TexifyException if an accent operand is invalid
     */
    public Formula readYaml(String yaml, String source) throws IOException, TexifyException {
        return read(YAML_MAPPER.readTree(yaml), source);
    }

    /**
     * Builds a formula from a parsed document. A document whose root is not a formula
     * is wrapped in an inline formula.
     *
     * @param document parsed document, may be null for empty content
     * @param source document name used in locations
     * @return the formula
     * @throws FormulaFormatException if the document is not a valid formula document
     * @throws TexifyException if an accent operand is invalid
     */
    public Formula read(JsonNode document, String source) throws FormulaFormatException, TexifyException {
        SourceSpan span = SourceSpan.root(source);
        if (document == null || document.isMissingNode() || document.isNull()) {
            throw new FormulaFormatException("empty document", span);
        }

        MathNode root = node(document, span);
        if (root instanceof Formula formula) {
            return formula;
        }
        return new Formula(false, List.of(root), span);
    }

    private MathNode node(JsonNode json, SourceSpan span) throws FormulaFormatException, TexifyException {
        if (json.isTextual() || json.isNumber()) {
            return atom(json.asText(), span);
        }
        if (json.isArray()) {
            return new Sequence(children(json, span), span);
        }
        if (!json.isObject()) {
            throw new FormulaFormatException("expected a node, got " + json.getNodeType(), span);
        }

        String type = text(json, TYPE, span);
        return switch (type) {
            case "formula" -> new Formula(
                json.path("block").asBoolean(false),
                children(required(json, "children", span), span.child("children")),
                span);
            case "atom" -> atom(text(json, "text", span), span);
            case "text" -> new LiteralText(text(json, "text", span), span);
            case "symbol" -> symbol(json, span);
            case "space" -> new Space(span);
            case "linebreak" -> new ForcedBreak(span);
            case "sequence" -> new Sequence(children(required(json, "children", span), span.child("children")), span);
            case "accent" -> Accent.of(
                child(json, "base", span),
                optionalChild(json, "accent", span),
                span.child("accent"),
                normalizer);
            case "frac" -> new Fraction(child(json, "num", span), child(json, "denom", span), span);
            case "binom" -> new Binomial(child(json, "upper", span), child(json, "lower", span), span);
            case "script" -> new Script(
                child(json, "base", span),
                optionalChild(json, "sub", span),
                optionalChild(json, "sup", span),
                span);
            case "align" -> alignPoint(json, span);
            case "sqrt" -> new Sqrt(child(json, "body", span), span);
            case "floor" -> new Floor(child(json, "body", span), span);
            case "ceil" -> new Ceil(child(json, "body", span), span);
            default -> throw new FormulaFormatException("unknown node type '" + type + "'", span.child(TYPE));
        };
    }

    private List<MathNode> children(JsonNode array, SourceSpan span) throws FormulaFormatException, TexifyException {
        if (!array.isArray()) {
            throw new FormulaFormatException("expected an array of nodes", span);
        }
        List<MathNode> children = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            children.add(node(array.get(i), span.child(i)));
        }
        return children;
    }

    private MathNode child(JsonNode json, String member, SourceSpan span) throws FormulaFormatException, TexifyException {
        return node(required(json, member, span), span.child(member));
    }

    private MathNode optionalChild(JsonNode json, String member, SourceSpan span)
            throws FormulaFormatException, TexifyException {
        JsonNode value = json.get(member);
        if (value == null || value.isNull()) {
            return null;
        }
        return node(value, span.child(member));
    }

    private static JsonNode required(JsonNode json, String member, SourceSpan span) throws FormulaFormatException {
        JsonNode value = json.get(member);
        if (value == null || value.isNull()) {
            throw new FormulaFormatException("missing member '" + member + "'", span);
        }
        return value;
    }

    private static String text(JsonNode json, String member, SourceSpan span) throws FormulaFormatException {
        JsonNode value = required(json, member, span);
        if (!value.isValueNode()) {
            throw new FormulaFormatException("member '" + member + "' must be a string", span.child(member));
        }
        return value.asText();
    }

    private static Atom atom(String text, SourceSpan span) throws FormulaFormatException {
        if (text.isEmpty()) {
            throw new FormulaFormatException("atom text must not be empty", span);
        }
        return new Atom(text, span);
    }

    private static Symbol symbol(JsonNode json, SourceSpan span) throws FormulaFormatException {
        String name = text(json, "name", span);
        if (name.isBlank()) {
            throw new FormulaFormatException("symbol name must not be blank", span.child("name"));
        }
        return new Symbol(name, span);
    }

    private static AlignPoint alignPoint(JsonNode json, SourceSpan span) throws FormulaFormatException {
        JsonNode index = required(json, "index", span);
        if (!index.canConvertToInt() || !index.isIntegralNumber() || index.asInt() < 1) {
            throw new FormulaFormatException("align index must be a positive integer", span.child("index"));
        }
        return new AlignPoint(index.asInt(), span);
    }
}
