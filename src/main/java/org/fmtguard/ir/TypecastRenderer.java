package org.fmtguard.ir;

/**
 * Reproduces every call with its original format string, casting each argument that was not
 * already cast to the type its specifier expects.
 * <p>
 * {@code printf("%d %s", n, (char*) name)} becomes {@code printf("%d %s", (int) (n), (char*) name)}.
 */
public class TypecastRenderer extends IrRenderer {

    public TypecastRenderer(IntermediateRepresentation ir) {
        super(ir);
    }

    @Override
    protected void renderSite(StringBuilder sb, Site site) {
        Interpolation<FormatValue> format = site.format();
        sb.append(site.function().functionName()).append('(');
        renderLeadingArgs(sb, site);

        sb.append('"');
        for (Interpolation.Entry<FormatValue> entry : format.entries()) {
            Specifier specifier = entry.value().specifier();
            source.appendTo(sb, entry.chunk());
            sb.append('%');
            source.appendTo(sb, specifier.options());
            sb.append(specifier.type().specifierChar());
        }
        source.appendTo(sb, format.last());
        sb.append('"');

        for (Interpolation.Entry<FormatValue> entry : format.entries()) {
            FormatValue value = entry.value();
            sb.append(", ");
            if (value.typeChecked()) {
                source.appendTo(sb, value.arg());
            } else {
                sb.append('(').append(value.type().cName()).append(") (");
                source.appendTo(sb, value.arg());
                sb.append(')');
            }
        }
        sb.append(')');
    }
}
