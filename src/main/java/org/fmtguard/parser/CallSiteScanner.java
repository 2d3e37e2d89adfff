package org.fmtguard.parser;

import org.fmtguard.diagnostics.FormatError;
import org.fmtguard.ir.FormatFunction;
import org.fmtguard.ir.FormatValue;
import org.fmtguard.ir.IntermediateRepresentation;
import org.fmtguard.ir.Interpolation;
import org.fmtguard.ir.ParseResult;
import org.fmtguard.ir.Site;
import org.fmtguard.lexer.SourceLexer;
import org.fmtguard.lexer.SourceText;
import org.fmtguard.lexer.SourceToken;
import org.fmtguard.lexer.SourceTokenType;
import org.fmtguard.lexer.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a whole C file once, validating every call to a formatting function.
 * <p>
 * The text between calls is kept as exact slices of the source, so a file renders back
 * unchanged apart from the calls themselves. A call that fails validation does not stop the
 * scan: every call is checked and all errors are reported together.
 */
public class CallSiteScanner {

    private final SourceText source;
    private final SourceLexer lexer;

    public CallSiteScanner(SourceText source) {
        this.source = source;
        this.lexer = new SourceLexer(source);
    }

    /**
     * Scans the file. Can only be called once per scanner.
     */
    public ParseResult scan() {
        List<Interpolation.Entry<Site>> sites = new ArrayList<>();
        List<FormatError> errors = new ArrayList<>();
        boolean failed = false;
        int chunkStart = 0;

        SourceToken token;
        while ((token = lexer.next()) != null) {
            FormatFunction function = token.type().function();
            if (function == null) {
                continue;
            }

            int afterName = lexer.getPosition();
            SourceToken paren = lexer.next();
            if (paren == null || paren.type() != SourceTokenType.LPAREN) {
                // named but not called, e.g. taking the function's address
                lexer.reset(afterName);
                continue;
            }

            Site site = parseSite(function, errors);
            if (site == null) {
                failed = true;
            } else if (!failed) {
                sites.add(new Interpolation.Entry<>(new Span(chunkStart, token.start()), site));
            }
            chunkStart = lexer.getPosition();
        }

        if (failed) {
            return ParseResult.failure(errors);
        }
        Interpolation<Site> interpolation = new Interpolation<>(sites, new Span(chunkStart, source.length()));
        return ParseResult.success(new IntermediateRepresentation(source, interpolation));
    }

    /**
     * Parses the arguments of a call whose opening parenthesis was just consumed. Whatever the
     * outcome, the lexer is left after the call's closing parenthesis.
     *
     * @return the validated site, or null if errors were recorded
     */
    private Site parseSite(FormatFunction function, List<FormatError> errors) {
        ArgumentSplitter args = new ArgumentSplitter(lexer);

        List<Span> leadingArgs = new ArrayList<>(function.leadingArgs());
        for (int i = 0; i < function.leadingArgs(); i++) {
            Arg arg = args.next();
            if (arg == null) {
                errors.add(new FormatError.MissingFunctionArgs(args.shortCircuit().span()));
                return null;
            }
            leadingArgs.add(arg.span());
        }

        FormatString format = args.nextFormatString(errors);
        if (format == null) {
            args.shortCircuit();
            return null;
        }

        SpecifierScanner specifiers = new SpecifierScanner(source, format.contents());
        Interpolation<FormatValue> values = FormatMatcher.match(format, specifiers, args, errors);
        return values == null ? null : Site.of(function, leadingArgs, values);
    }
}
