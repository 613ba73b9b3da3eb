package com.witty.domain.formalize.model;

import java.util.List;

/**
 * A claim before identifiers are assigned.
 *
 * @param text            claim text
 * @param start           start offset in the normalized text
 * @param end             end offset (exclusive) in the normalized text
 * @param category        EVENT or RELATIONAL
 * @param modal           governing modal operator (nullable)
 * @param presuppositions texts of claims implied by the claim's quantifiers, in order
 */
public record ClaimDraft(
        String text,
        int start,
        int end,
        ClaimCategory category,
        ModalTag modal,
        List<String> presuppositions
) {

    public ClaimDraft {
        presuppositions = presuppositions == null ? List.of() : List.copyOf(presuppositions);
    }

    public int length() {
        return end - start;
    }
}
