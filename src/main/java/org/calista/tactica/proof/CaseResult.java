package org.calista.tactica.proof;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a case split.
 *
 * @param parentBranch cursor on the split node, label {@code <parentPath>_cases}
 * @param cases        one branch per case, in declaration order
 * @param parentPath   label of the branch the split was opened from
 */
public record CaseResult(ProofBranch parentBranch, List<ProofBranch> cases, String parentPath) {

    public CaseResult {
        Objects.requireNonNull(parentBranch, "parentBranch");
        cases = cases == null ? List.of() : List.copyOf(cases);
    }

    public int caseCount() {
        return cases.size();
    }

    /** @throws IndexOutOfBoundsException for an index outside {@code [0, caseCount())} */
    public ProofBranch caseAt(int index) {
        return cases.get(index);
    }

    /** Marks every case branch complete. */
    public CaseResult completeAllCases() {
        for (ProofBranch c : cases) c.markComplete();
        return this;
    }

    /** Marks the split node complete. */
    public ProofBranch shouldComplete() {
        return parentBranch.markComplete();
    }
}
