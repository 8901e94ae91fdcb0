package com.queryforge.safety;

import com.queryforge.model.DialectFamily;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rules for SQL dialects: read-only prefix in strict mode, keyword denylist and injection shapes.
 */
public class RelationalRules implements FamilyRules {

    static final String STRICT_MODE_VIOLATION = "Only SELECT statements allowed in strict mode";
    static final String INJECTION_VIOLATION = "Potential SQL injection pattern detected";

    static final List<String> UNSAFE_KEYWORDS = List.of(
            "CREATE", "ALTER", "DROP", "TRUNCATE",
            "INSERT", "UPDATE", "DELETE", "MERGE", "UPSERT",
            "GRANT", "REVOKE",
            "COMMIT", "ROLLBACK", "SAVEPOINT",
            "EXEC", "EXECUTE", "CALL", "PROCEDURE", "FUNCTION",
            "INDEX", "TRIGGER", "VIEW", "SCHEMA", "DATABASE",
            "USER", "ROLE", "LOGIN", "PASSWORD",
            "SLEEP", "WAITFOR", "BENCHMARK", "LOAD_FILE", "INTO OUTFILE"
    );

    private static final List<PatternRule> INJECTION_PATTERNS = List.of(
            PatternRule.of(";\\s*(DROP|DELETE|INSERT|UPDATE)", Pattern.CASE_INSENSITIVE, INJECTION_VIOLATION),
            PatternRule.of("UNION\\s+ALL\\s+SELECT", Pattern.CASE_INSENSITIVE, INJECTION_VIOLATION),
            PatternRule.of("--\\s*\\w+", 0, INJECTION_VIOLATION),
            PatternRule.of("/\\*.*?\\*/", Pattern.DOTALL, INJECTION_VIOLATION)
    );

    private final List<PatternRule> keywordRules;

    public RelationalRules() {
        List<PatternRule> rules = new ArrayList<>(UNSAFE_KEYWORDS.size());
        for (String keyword : UNSAFE_KEYWORDS) {
            rules.add(PatternRule.of(
                    "\\b" + Pattern.quote(keyword) + "\\b",
                    Pattern.CASE_INSENSITIVE,
                    "Unsafe SQL keyword detected: " + keyword
            ));
        }
        this.keywordRules = List.copyOf(rules);
    }

    @Override
    public DialectFamily family() {
        return DialectFamily.RELATIONAL;
    }

    @Override
    public List<String> check(String query, boolean strict) {
        List<String> violations = new ArrayList<>();

        if (strict) {
            String head = query.trim().toUpperCase(Locale.ROOT);
            if (!head.startsWith("SELECT") && !head.startsWith("WITH")) {
                violations.add(STRICT_MODE_VIOLATION);
            }
        }

        PatternRule.collect(keywordRules, query, violations);
        PatternRule.collect(INJECTION_PATTERNS, query, violations);
        return violations;
    }
}
