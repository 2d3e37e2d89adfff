package org.fmtguard.ir;

import org.fmtguard.lexer.SourceText;
import org.fmtguard.parser.CallSiteScanner;

/**
 * Intermediate representation of a fully validated C file: the code between calls as literal
 * chunks, and every call to a formatting function as a validated {@link Site}.
 * <p>
 * Instances only exist for files in which every call validated. All text is kept as spans into
 * the {@link SourceText} the representation was parsed from.
 */
public final class IntermediateRepresentation {

    private final SourceText source;
    private final Interpolation<Site> sites;

    public IntermediateRepresentation(SourceText source, Interpolation<Site> sites) {
        this.source = source;
        this.sites = sites;
    }

    /**
     * Parses C source code into an intermediate representation, or collects every error found.
     */
    public static ParseResult parse(String source) {
        return parse(new SourceText(source));
    }

    public static ParseResult parse(SourceText source) {
        return new CallSiteScanner(source).scan();
    }

    public SourceText source() {
        return source;
    }

    public Interpolation<Site> sites() {
        return sites;
    }

    /**
     * Returns a view that replaces {@code printf} and family with optimized calls.
     */
    public IrRenderer displayOptimize() {
        return new OptimizeRenderer(this);
    }

    /**
     * Returns a view that adds type casts to all formatted arguments.
     */
    public IrRenderer displayTypecast() {
        return new TypecastRenderer(this);
    }
}
