package org.fmtguard.ir;

import org.fmtguard.lexer.SourceText;

/**
 * Stateless view that turns an {@link IntermediateRepresentation} back into C source.
 * <p>
 * Literal chunks are copied verbatim; each call site is rewritten by the subclass.
 */
public abstract class IrRenderer {

    protected final IntermediateRepresentation ir;
    protected final SourceText source;

    protected IrRenderer(IntermediateRepresentation ir) {
        this.ir = ir;
        this.source = ir.source();
    }

    /**
     * Renders the whole file.
     */
    public String render() {
        StringBuilder sb = new StringBuilder(source.length() + 64 * ir.sites().size());
        renderTo(sb);
        return sb.toString();
    }

    public void renderTo(StringBuilder sb) {
        for (Interpolation.Entry<Site> entry : ir.sites().entries()) {
            source.appendTo(sb, entry.chunk());
            renderSite(sb, entry.value());
        }
        source.appendTo(sb, ir.sites().last());
    }

    protected abstract void renderSite(StringBuilder sb, Site site);

    /**
     * Writes the buffer and size arguments of {@code sprintf} and {@code snprintf}, each followed
     * by {@code ", "}. Writes nothing for {@code printf}.
     */
    protected void renderLeadingArgs(StringBuilder sb, Site site) {
        if (site instanceof Site.Sprintf sprintf) {
            sb.append("(char* restrict) (");
            source.appendTo(sb, sprintf.buffer());
            sb.append("), ");
        } else if (site instanceof Site.Snprintf snprintf) {
            sb.append("(char* restrict) (");
            source.appendTo(sb, snprintf.buffer());
            sb.append("), (size_t) (");
            source.appendTo(sb, snprintf.bufsz());
            sb.append("), ");
        }
    }

    @Override
    public String toString() {
        return render();
    }
}
