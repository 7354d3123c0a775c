package io.optionsnap.domain.model;

/**
 * Option side as encoded in the last part of an exchange option symbol.
 */
public enum OptionSide {
    CALL("C"),
    PUT("P");

    private final String code;

    OptionSide(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Resolve a symbol side code ("C" or "P").
     *
     * @throws SymbolParseException if the code is not a known side
     */
    public static OptionSide fromCode(String code) {
        for (OptionSide side : values()) {
            if (side.code.equals(code)) {
                return side;
            }
        }
        throw new SymbolParseException(code, "unknown option side '" + code + "'");
    }
}
