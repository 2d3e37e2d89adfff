package org.fmtguard.ir;

/**
 * C types that can be formatted.
 */
public enum CType {
    INT("int", 'd', "fmt_int"),
    FLOAT("float", 'f', "fmt_float"),
    STRING("char*", 's', "fmt_string");

    private final String cName;
    private final char specifierChar;
    private final String formatFunction;

    CType(String cName, char specifierChar, String formatFunction) {
        this.cName = cName;
        this.specifierChar = specifierChar;
        this.formatFunction = formatFunction;
    }

    /**
     * The C spelling of the type, as written inside a cast.
     */
    public String cName() {
        return cName;
    }

    /**
     * Conversion letter that tells C how to format a value of this type.
     */
    public char specifierChar() {
        return specifierChar;
    }

    /**
     * Name of the runtime function pointer that formats a value of this type in optimized output.
     */
    public String formatFunction() {
        return formatFunction;
    }

    /**
     * Whether optimized output passes the value by address rather than by value.
     */
    public boolean passedByAddress() {
        return this != STRING;
    }

    @Override
    public String toString() {
        return cName;
    }
}
