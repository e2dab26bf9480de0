package com.mathtex.core.model;

/**
 * Visitor over the closed set of {@link MathNode} variants.
 *
 * @param <R> result type
 * @param <X> exception type the visit methods may throw
 */
public interface MathNodeVisitor<R, X extends Exception> {

    R visitFormula(Formula formula) throws X;

    R visitAtom(Atom atom) throws X;

    R visitSymbol(Symbol symbol) throws X;

    R visitLiteralText(LiteralText text) throws X;

    R visitSpace(Space space) throws X;

    R visitForcedBreak(ForcedBreak forcedBreak) throws X;

    R visitSequence(Sequence sequence) throws X;

    R visitAccent(Accent accent) throws X;

    R visitFraction(Fraction fraction) throws X;

    R visitBinomial(Binomial binomial) throws X;

    R visitScript(Script script) throws X;

    R visitAlignPoint(AlignPoint alignPoint) throws X;

    R visitSqrt(Sqrt sqrt) throws X;

    R visitFloor(Floor floor) throws X;

    R visitCeil(Ceil ceil) throws X;
}
