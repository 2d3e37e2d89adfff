package org.fmtguard.ir;

import org.fmtguard.lexer.Span;

import java.util.List;

/**
 * A validated call to one of the formatting functions.
 * <p>
 * Leading arguments such as the destination buffer are kept as raw source text; only the
 * format string and the values it consumes are validated.
 */
public abstract class Site {

    private final Interpolation<FormatValue> format;

    protected Site(Interpolation<FormatValue> format) {
        this.format = format;
    }

    /**
     * Creates the site for {@code function} from its leading arguments and validated format.
     *
     * @throws IllegalArgumentException if the number of leading arguments does not match the function
     */
    public static Site of(FormatFunction function, List<Span> leadingArgs, Interpolation<FormatValue> format) {
        if (leadingArgs.size() != function.leadingArgs()) {
            throw new IllegalArgumentException(function.functionName() + " takes " + function.leadingArgs()
                    + " leading arguments, got " + leadingArgs.size());
        }
        return switch (function) {
            case PRINTF -> new Printf(format);
            case SPRINTF -> new Sprintf(leadingArgs.get(0), format);
            case SNPRINTF -> new Snprintf(leadingArgs.get(0), leadingArgs.get(1), format);
        };
    }

    public abstract FormatFunction function();

    public Interpolation<FormatValue> format() {
        return format;
    }

    /**
     * {@code printf(format, ...)}
     */
    public static final class Printf extends Site {
        public Printf(Interpolation<FormatValue> format) {
            super(format);
        }

        @Override
        public FormatFunction function() {
            return FormatFunction.PRINTF;
        }
    }

    /**
     * {@code sprintf(buffer, format, ...)}
     */
    public static final class Sprintf extends Site {
        private final Span buffer;

        public Sprintf(Span buffer, Interpolation<FormatValue> format) {
            super(format);
            this.buffer = buffer;
        }

        public Span buffer() {
            return buffer;
        }

        @Override
        public FormatFunction function() {
            return FormatFunction.SPRINTF;
        }
    }

    /**
     * {@code snprintf(buffer, bufsz, format, ...)}
     */
    public static final class Snprintf extends Site {
        private final Span buffer;
        private final Span bufsz;

        public Snprintf(Span buffer, Span bufsz, Interpolation<FormatValue> format) {
            super(format);
            this.buffer = buffer;
            this.bufsz = bufsz;
        }

        public Span buffer() {
            return buffer;
        }

        public Span bufsz() {
            return bufsz;
        }

        @Override
        public FormatFunction function() {
            return FormatFunction.SNPRINTF;
        }
    }
}
