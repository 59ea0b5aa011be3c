package com.monitoring.customgraph.access;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum Privilege {
    IR("priv_ir"),
    IW("priv_iw"),
    IM("priv_im"),
    AR("priv_ar"),
    AW("priv_aw"),
    LW("priv_lw"),
    UM("priv_um"),
    DM("priv_dm"),
    LM("priv_lm"),
    PM("priv_pm");

    private final String column;

    Privilege(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    /**
     * Parses a concatenation of codes such as {@code "IR"} or {@code "ARIR"}, case-insensitive.
     *
     * @throws IllegalArgumentException if the string is blank, has an odd length or names an unknown code
     */
    public static Set<Privilege> parse(String codes) {
        if (codes == null || codes.isBlank()) {
            throw new IllegalArgumentException("Privilege string must not be empty");
        }
        String normalized = codes.trim().toUpperCase(Locale.ROOT);
        if (normalized.length() % 2 != 0) {
            throw new IllegalArgumentException("Malformed privilege string: " + codes);
        }
        EnumSet<Privilege> result = EnumSet.noneOf(Privilege.class);
        for (int i = 0; i < normalized.length(); i += 2) {
            String code = normalized.substring(i, i + 2);
            try {
                result.add(Privilege.valueOf(code));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown privilege code: " + code, e);
            }
        }
        return result;
    }
}
