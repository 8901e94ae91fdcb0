package com.queryforge.safety;

import com.queryforge.model.DialectFamily;

import java.util.List;

/**
 * Lexical safety rules for one dialect family.
 */
public interface FamilyRules {

    /**
     * @return family these rules apply to
     */
    DialectFamily family();

    /**
     * Collect violations for a non-blank query.
     *
     * @param query candidate query
     * @param strict whether read-only output is enforced
     * @return violations in detection order, empty when none
     */
    List<String> check(String query, boolean strict);
}
