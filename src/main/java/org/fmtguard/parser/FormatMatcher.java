package org.fmtguard.parser;

import org.fmtguard.diagnostics.FormatError;
import org.fmtguard.ir.FormatValue;
import org.fmtguard.ir.Interpolation;
import org.fmtguard.ir.Specifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Pairs the specifiers of a format string with the arguments that follow it.
 * <p>
 * Both sequences are advanced in lock step. Arguments without a cast are accepted for any
 * specifier. A cast that disagrees with its specifier invalidates the call, but matching goes
 * on so that later mismatches in the same call are reported too. Running out of arguments or
 * specifiers before the other ends matching immediately, since every later pairing would be
 * off by one.
 */
public final class FormatMatcher {

    /**
     * What one step of the lock step found.
     */
    enum Step {
        BOTH,
        SPECIFIER_ONLY,
        ARGUMENT_ONLY,
        NEITHER;

        static Step of(Specifier specifier, Arg arg) {
            if (specifier != null) {
                return arg != null ? BOTH : SPECIFIER_ONLY;
            }
            return arg != null ? ARGUMENT_ONLY : NEITHER;
        }
    }

    private FormatMatcher() {
    }

    /**
     * Matches the remaining arguments against the format's specifiers.
     *
     * @param format     the format string the specifiers come from
     * @param specifiers scanner over the format string's contents
     * @param args       the arguments after the format string
     * @param errors     receives every problem found
     * @return the validated values, or null if any error was recorded
     */
    public static Interpolation<FormatValue> match(FormatString format, SpecifierScanner specifiers,
                                                   ArgumentSplitter args, List<FormatError> errors) {
        // null once a cast mismatch was found: only further mismatches are looked for
        List<Interpolation.Entry<FormatValue>> values = new ArrayList<>(4);

        while (true) {
            Specifier specifier = specifiers.next();
            Arg arg = args.next();

            switch (Step.of(specifier, arg)) {
                case BOTH -> {
                    Arg.Cast cast = arg.cast();
                    if (cast != null && cast.type() != specifier.type()) {
                        errors.add(new FormatError.SpecifierCastMismatch(
                                specifier.span(), specifier.type(), cast.span(), cast.type()));
                        values = null;
                    } else if (values != null) {
                        FormatValue value = new FormatValue(specifier, arg.span(), cast != null);
                        values.add(new Interpolation.Entry<>(specifiers.before(), value));
                    }
                }
                case SPECIFIER_ONLY -> {
                    ArgSummary summary = args.shortCircuit();
                    errors.add(new FormatError.ExcessSpecifiers(format.literal(), summary.span(), specifiers.count() + 1));
                    return null;
                }
                case ARGUMENT_ONLY -> {
                    ArgSummary summary = args.shortCircuit();
                    errors.add(new FormatError.ExcessArgs(format.literal(), summary.span(), summary.count() + 1));
                    return null;
                }
                case NEITHER -> {
                    return values == null ? null : new Interpolation<>(values, specifiers.remainder());
                }
            }
        }
    }
}
