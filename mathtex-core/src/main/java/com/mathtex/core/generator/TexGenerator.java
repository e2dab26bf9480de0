package com.mathtex.core.generator;

import com.mathtex.core.error.TexifyException;
import com.mathtex.core.model.Formula;
import com.mathtex.core.symbol.SymbolTable;
import com.mathtex.core.texify.Texifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Generates math markup for whole formulas.
 *
 * <p>Each call runs one traversal with its own builder. The first failure aborts the
 * conversion and no partial markup is returned.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * TexGenerator generator = new TexGenerator();
 * Formula formula = Formula.block(new Fraction(new Atom("1"), new Atom("2")));
 *
 * GeneratedMarkup markup = generator.generate(formula, new GeneratorConfig(DelimiterStyle.DOLLARS));
 * // markup.content() is "$$\frac{1}{2}$$"
 * }</pre>
 */
public class TexGenerator {

    private static final Logger log = LoggerFactory.getLogger(TexGenerator.class);

    private final Texifier texifier;

    public TexGenerator() {
        this(SymbolTable.standard());
    }

    public TexGenerator(SymbolTable symbols) {
        this.texifier = new Texifier(symbols);
    }

    /**
     * Generates markup for a formula.
     *
     * @param formula the formula to convert
     * @param config generation settings
     * @return generated markup
     * @throws TexifyException if the formula contains an unknown symbol or a node that
     *                         cannot be written inline
     */
    public GeneratedMarkup generate(Formula formula, GeneratorConfig config) throws TexifyException {
        Objects.requireNonNull(formula, "formula must not be null");
        Objects.requireNonNull(config, "config must not be null");

        log.debug("Generating markup for {} formula with {} children",
            formula.block() ? "block" : "inline", formula.children().size());

        String tex = texifier.texify(formula);
        String content = config.delimiters().wrap(tex, formula.block());

        log.debug("Generated {} characters of markup", content.length());
        return new GeneratedMarkup(content, formula.block());
    }
}
