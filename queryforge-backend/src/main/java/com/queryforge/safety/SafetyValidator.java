package com.queryforge.safety;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.queryforge.model.Dialect;
import com.queryforge.model.DialectFamily;
import com.queryforge.model.SafetyVerdict;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Lexical safety gate for generated queries.
 *
 * Dispatches to the rule set of the dialect's family, then applies checks shared by every family
 * (system command and file access indicators). Labels that match no known dialect are treated as relational.
 */
@Component
public class SafetyValidator {

    static final String EMPTY_QUERY_VIOLATION = "Empty query";
    static final String SYSTEM_COMMAND_VIOLATION = "System command detected";
    static final String FILE_OPERATION_VIOLATION = "File operation detected";

    private static final int CI = Pattern.CASE_INSENSITIVE;

    private static final List<PatternRule> SYSTEM_COMMAND_PATTERNS = List.of(
            PatternRule.of("xp_cmdshell", CI, SYSTEM_COMMAND_VIOLATION),
            PatternRule.of("sp_executesql", CI, SYSTEM_COMMAND_VIOLATION),
            PatternRule.of("eval\\s*\\(", CI, SYSTEM_COMMAND_VIOLATION),
            PatternRule.of("exec\\s*\\(", CI, SYSTEM_COMMAND_VIOLATION),
            PatternRule.of("system\\s*\\(", CI, SYSTEM_COMMAND_VIOLATION),
            PatternRule.of("\\bos\\.", CI, SYSTEM_COMMAND_VIOLATION),
            PatternRule.of("import\\s+os", CI, SYSTEM_COMMAND_VIOLATION),
            PatternRule.of("subprocess", CI, SYSTEM_COMMAND_VIOLATION)
    );

    private static final List<PatternRule> FILE_OPERATION_PATTERNS = List.of(
            PatternRule.of("LOAD_FILE", CI, FILE_OPERATION_VIOLATION),
            PatternRule.of("INTO\\s+OUTFILE", CI, FILE_OPERATION_VIOLATION),
            PatternRule.of("LOAD\\s+DATA", CI, FILE_OPERATION_VIOLATION),
            PatternRule.of("SELECT\\s+.*\\s+INTO\\s+DUMPFILE", CI | Pattern.DOTALL, FILE_OPERATION_VIOLATION)
    );

    private final Map<DialectFamily, FamilyRules> rulesByFamily = new EnumMap<>(DialectFamily.class);

    @Autowired
    public SafetyValidator(ObjectMapper objectMapper) {
        this(List.of(new RelationalRules(), new DocumentStoreRules(objectMapper)));
    }

    SafetyValidator(List<FamilyRules> familyRules) {
        for (FamilyRules rules : familyRules) {
            rulesByFamily.put(rules.family(), rules);
        }
        for (DialectFamily family : DialectFamily.values()) {
            if (!rulesByFamily.containsKey(family)) {
                throw new IllegalArgumentException("No safety rules registered for family " + family);
            }
        }
    }

    /**
     * Validate a candidate query.
     *
     * @param query cleaned model output
     * @param dialect dialect label
     * @param strict whether only read-only statements are allowed
     * @return verdict listing every violation found
     */
    public SafetyVerdict validate(String query, String dialect, boolean strict) {
        if (query == null || query.isBlank()) {
            return SafetyVerdict.of(List.of(EMPTY_QUERY_VIOLATION));
        }

        DialectFamily family = Dialect.fromLabel(dialect)
                .map(Dialect::getFamily)
                .orElse(DialectFamily.RELATIONAL);

        List<String> violations = new ArrayList<>(rulesByFamily.get(family).check(query, strict));
        PatternRule.collect(SYSTEM_COMMAND_PATTERNS, query, violations);
        PatternRule.collect(FILE_OPERATION_PATTERNS, query, violations);
        return SafetyVerdict.of(violations);
    }
}
