package com.mathtex.core.texify;

import com.mathtex.core.error.TexifyException;
import com.mathtex.core.error.UnknownSymbolException;
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
import com.mathtex.core.model.MathNodeVisitor;
import com.mathtex.core.model.Script;
import com.mathtex.core.model.Sequence;
import com.mathtex.core.model.Space;
import com.mathtex.core.model.Sqrt;
import com.mathtex.core.model.Symbol;
import com.mathtex.core.symbol.MathSymbol;
import com.mathtex.core.symbol.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts formula trees into TeX-like math markup.
 *
 * <h2>Output</h2>
 * <ul>
 *   <li><b>Atoms:</b> single graphemes are escaped character by character; longer atoms
 *       are set upright in {@code \mathrm{...}}, like literal text</li>
 *   <li><b>Fractions:</b> {@code \frac{num}{denom}}</li>
 *   <li><b>Binomials:</b> {@code \binom{upper}{lower}}</li>
 *   <li><b>Scripts:</b> {@code base_{sub}^{sup}}</li>
 *   <li><b>Roots:</b> {@code \sqrt{body}}</li>
 *   <li><b>Floor/Ceil:</b> {@code \left\lfloor body\right\rfloor }, same for ceil</li>
 *   <li><b>Accents:</b> {@code \tilde{base}}, or the bare base if the table has no
 *       command for the accent</li>
 * </ul>
 *
 * <h2>Implicit grouping</h2>
 * <p>Fraction operands and scripts already group their content, so one outer pair of
 * auto-sized parentheses around them is removed: {@code (x+1)/2} renders as
 * {@code \frac{x+1}{2}}. Further nested pairs stay visible.
 *
 * <p>A texifier holds no per-conversion state; each call writes into its own
 * {@link TexBuilder}, so one instance can serve concurrent conversions.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Texifier texifier = new Texifier();
 * String tex = texifier.texify(new Script(new Atom("a"), new Atom("i"), null)); // a_{i}
 * }</pre>
 */
public final class Texifier {

    private static final Logger log = LoggerFactory.getLogger(Texifier.class);

    private static final String OPEN_PAREN = TexBuilder.LEFT + "(";
    private static final String CLOSE_PAREN = TexBuilder.RIGHT + ")";

    private static final String LITERAL_START = "\\mathrm{";
    private static final String GROUP_START = "{";
    private static final String GROUP_END = "}";
    private static final String GROUP_SEPARATOR = "}{";
    private static final String FORCED_BREAK = "\\\\";
    private static final String FRACTION = "\\frac{";
    private static final String BINOMIAL = "\\binom{";
    private static final String SUBSCRIPT = "_{";
    private static final String SUPERSCRIPT = "^{";
    private static final String SQRT = "\\sqrt{";
    private static final String FLOOR_OPEN = "\\left\\lfloor ";
    private static final String FLOOR_CLOSE = "\\right\\rfloor ";
    private static final String CEIL_OPEN = "\\left\\lceil ";
    private static final String CEIL_CLOSE = "\\right\\rceil ";

    private final SymbolTable symbols;

    public Texifier() {
        this(SymbolTable.standard());
    }

    public Texifier(SymbolTable symbols) {
        this.symbols = Objects.requireNonNull(symbols, "symbols must not be null");
    }

    /**
     * Converts a node into markup with a fresh builder.
     *
     * @param node root of the tree to convert
     * @return the markup
     * @throws TexifyException on the first structural failure anywhere in the tree
     */
    public String texify(MathNode node) throws TexifyException {
        TexBuilder builder = new TexBuilder(symbols);
        texify(node, builder);
        return builder.finish();
    }

    /**
     * Converts a node into an existing builder.
     *
     * <p>Formulas, nested or not, write their children directly; the {@code block} flag
     * only matters to whoever delimits the result.
     *
     * @param node root of the tree to convert
     * @param builder builder to write into
     * @throws TexifyException on the first structural failure anywhere in the tree
     */
    public void texify(MathNode node, TexBuilder builder) throws TexifyException {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(builder, "builder must not be null");

        Emitter emitter = new Emitter(builder);
        if (node instanceof Formula formula) {
            emitter.all(formula.children());
        } else {
            node.accept(emitter);
        }
    }

    /**
     * Removes one pair of auto-sized parentheses enclosing the whole markup.
     *
     * <p>The opening {@code \left(} at the start must be matched, at the same nesting
     * depth, by the {@code \right)} at the very end; otherwise the markup is returned
     * unchanged. {@code \left(a\right)+\left(b\right)} is left alone.
     *
     * @param tex rendered operand
     * @return the operand without its outer parentheses
     */
    static String stripOuterParens(String tex) {
        if (!tex.startsWith(OPEN_PAREN) || !tex.endsWith(CLOSE_PAREN)) {
            return tex;
        }

        int depth = 0;
        int i = 0;
        while (i < tex.length()) {
            if (tex.startsWith(OPEN_PAREN, i)) {
                depth++;
                i += OPEN_PAREN.length();
            } else if (tex.startsWith(CLOSE_PAREN, i)) {
                depth--;
                i += CLOSE_PAREN.length();
                if (depth == 0) {
                    break;
                }
            } else {
                i++;
            }
        }

        if (depth != 0 || i != tex.length()) {
            return tex;
        }
        return tex.substring(OPEN_PAREN.length(), tex.length() - CLOSE_PAREN.length());
    }

    private static boolean isSupportive(int codepoint) {
        return codepoint == '|' || codepoint == '‖';
    }

    /**
     * Writes one traversal into one builder.
     */
    private final class Emitter implements MathNodeVisitor<Void, TexifyException> {

        private final TexBuilder builder;

        private Emitter(TexBuilder builder) {
            this.builder = builder;
        }

        void all(List<MathNode> nodes) throws TexifyException {
            for (MathNode node : nodes) {
                node.accept(this);
            }
        }

        /**
         * Renders a node into a scratch builder and splices it in without its outer
         * parentheses.
         */
        void trimmed(MathNode node) throws TexifyException {
            TexBuilder scratch = new TexBuilder(symbols);
            node.accept(new Emitter(scratch));
            builder.pushVerbatim(stripOuterParens(scratch.finish()));
        }

        void literal(String text) {
            builder.markSupport();
            builder.pushVerbatim(LITERAL_START);
            text.codePoints().forEach(builder::pushEscaped);
            builder.pushVerbatim(GROUP_END);
            builder.markSupport();
        }

        @Override
        public Void visitFormula(Formula formula) throws TexifyException {
            all(formula.children());
            return null;
        }

        @Override
        public Void visitAtom(Atom atom) {
            if (!atom.isSingleGrapheme()) {
                literal(atom.text());
                return null;
            }

            atom.text().codePoints().forEach(c -> {
                boolean supportive = isSupportive(c);
                if (supportive) {
                    builder.markSupport();
                }
                builder.pushEscaped(c);
                if (supportive) {
                    builder.markSupport();
                }
            });
            return null;
        }

        @Override
        public Void visitSymbol(Symbol symbol) throws TexifyException {
            int codepoint = symbols.resolve(symbol.name())
                .orElseThrow(() -> new UnknownSymbolException(symbol.name(), symbol.span()));
            builder.pushEscaped(codepoint);
            return null;
        }

        @Override
        public Void visitLiteralText(LiteralText text) {
            literal(text.text());
            return null;
        }

        @Override
        public Void visitSpace(Space space) {
            builder.recordWeakSpace();
            return null;
        }

        @Override
        public Void visitForcedBreak(ForcedBreak forcedBreak) {
            builder.pushVerbatim(FORCED_BREAK);
            return null;
        }

        @Override
        public Void visitSequence(Sequence sequence) throws TexifyException {
            all(sequence.children());
            return null;
        }

        @Override
        public Void visitAccent(Accent accent) throws TexifyException {
            Optional<MathSymbol> command = symbols.lookupAccent(accent.accent());
            if (command.isEmpty()) {
                log.debug("No accent command for {}, rendering the base alone",
                    SymbolTable.formatCodepoint(accent.accent()));
                accent.base().accept(this);
                return null;
            }

            builder.pushVerbatim("\\" + command.get().command() + GROUP_START);
            accent.base().accept(this);
            builder.pushVerbatim(GROUP_END);
            return null;
        }

        @Override
        public Void visitFraction(Fraction fraction) throws TexifyException {
            builder.pushVerbatim(FRACTION);
            trimmed(fraction.num());
            builder.pushVerbatim(GROUP_SEPARATOR);
            trimmed(fraction.denom());
            builder.pushVerbatim(GROUP_END);
            return null;
        }

        @Override
        public Void visitBinomial(Binomial binomial) throws TexifyException {
            builder.pushVerbatim(BINOMIAL);
            binomial.upper().accept(this);
            builder.pushVerbatim(GROUP_SEPARATOR);
            binomial.lower().accept(this);
            builder.pushVerbatim(GROUP_END);
            return null;
        }

        @Override
        public Void visitScript(Script script) throws TexifyException {
            script.base().accept(this);

            if (script.sub() != null) {
                builder.pushVerbatim(SUBSCRIPT);
                trimmed(script.sub());
                builder.pushVerbatim(GROUP_END);
            }

            if (script.sup() != null) {
                builder.pushVerbatim(SUPERSCRIPT);
                trimmed(script.sup());
                builder.pushVerbatim(GROUP_END);
            }
            return null;
        }

        @Override
        public Void visitAlignPoint(AlignPoint alignPoint) {
            return null;
        }

        @Override
        public Void visitSqrt(Sqrt sqrt) throws TexifyException {
            builder.pushVerbatim(SQRT);
            sqrt.body().accept(this);
            builder.pushVerbatim(GROUP_END);
            return null;
        }

        @Override
        public Void visitFloor(Floor floor) throws TexifyException {
            builder.pushVerbatim(FLOOR_OPEN);
            floor.body().accept(this);
            builder.pushVerbatim(FLOOR_CLOSE);
            return null;
        }

        @Override
        public Void visitCeil(Ceil ceil) throws TexifyException {
            builder.pushVerbatim(CEIL_OPEN);
            ceil.body().accept(this);
            builder.pushVerbatim(CEIL_CLOSE);
            return null;
        }
    }
}
