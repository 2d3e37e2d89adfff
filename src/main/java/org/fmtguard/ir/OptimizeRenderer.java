package org.fmtguard.ir;

/**
 * Replaces every call with its fixed-arity {@code safe_} counterpart.
 * <p>
 * Each formatted value becomes three arguments: the literal chunk before it, a pointer to the
 * value and the formatter for its type. They are preceded by the total number of arguments that
 * follow, {@code 3 * values + 1}, which is how the runtime knows how many to read, and followed
 * by the trailing chunk. For example {@code printf("Total: %d\n", n)} becomes
 * {@code safe_printf(4, "Total: ", (void*) &(n), fmt_int, "\n")}.
 */
public class OptimizeRenderer extends IrRenderer {

    public OptimizeRenderer(IntermediateRepresentation ir) {
        super(ir);
    }

    /**
     * Number of arguments following the count for a format with {@code values} values.
     */
    public static int argumentCount(int values) {
        return values * 3 + 1;
    }

    @Override
    protected void renderSite(StringBuilder sb, Site site) {
        Interpolation<FormatValue> format = site.format();
        sb.append(site.function().safeName()).append('(');
        renderLeadingArgs(sb, site);
        sb.append(argumentCount(format.size()));

        for (Interpolation.Entry<FormatValue> entry : format.entries()) {
            FormatValue value = entry.value();
            sb.append(", \"");
            source.appendTo(sb, entry.chunk());
            sb.append("\", (void*) ");
            if (value.type().passedByAddress()) {
                sb.append('&');
            }
            sb.append('(');
            source.appendTo(sb, value.arg());
            sb.append("), ").append(value.type().formatFunction());
        }

        sb.append(", \"");
        source.appendTo(sb, format.last());
        sb.append("\")");
    }
}
