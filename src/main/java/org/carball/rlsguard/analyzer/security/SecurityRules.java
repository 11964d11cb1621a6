package org.carball.rlsguard.analyzer.security;

import java.util.List;
import java.util.regex.Pattern;

/**
 * The default rule table, in evaluation order.
 */
public final class SecurityRules {

    static final String AUTH_UID_CALL = "auth.uid()";

    private SecurityRules() {
        // Utility class - prevent instantiation
    }

    public static List<SecurityRule> defaults() {
        return List.of(
                new InjectionPatternRule("OR_STRING_TAUTOLOGY",
                        Pattern.compile("'\\s*OR\\s*'1'\\s*=\\s*'1", Pattern.CASE_INSENSITIVE)),
                new InjectionPatternRule("STATEMENT_INJECTION",
                        Pattern.compile(";\\s*(DROP|DELETE|UPDATE|INSERT)", Pattern.CASE_INSENSITIVE)),
                new InjectionPatternRule("DYNAMIC_EXECUTE",
                        Pattern.compile("EXECUTE\\s+", Pattern.CASE_INSENSITIVE)),
                new InjectionPatternRule("DOLLAR_QUOTING",
                        Pattern.compile("\\$\\$[^$]*\\$\\$")),
                new UnrestrictedTrueRule(),
                new MissingIdentityCheckRule(),
                new TautologyBypassRule()
        );
    }
}
