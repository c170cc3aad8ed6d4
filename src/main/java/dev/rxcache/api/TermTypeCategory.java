package dev.rxcache.api;

import java.util.Set;

public enum TermTypeCategory {
    INGREDIENT,
    DRUG,
    OTHER;

    public static final Set<String> INGREDIENT_TTYS = Set.of("IN", "MIN", "PIN");
    public static final Set<String> DRUG_TTYS = Set.of("SCD", "SBD", "GPCK", "BPCK");

    public static TermTypeCategory of(String tty) {
        if (tty == null) {
            return OTHER;
        }
        if (INGREDIENT_TTYS.contains(tty)) {
            return INGREDIENT;
        }
        return DRUG_TTYS.contains(tty) ? DRUG : OTHER;
    }
}
