package com.ippcode.analyzer.service;

import com.ippcode.analyzer.grammar.GrammarEntry;
import com.ippcode.analyzer.grammar.GrammarTable;
import com.ippcode.analyzer.model.Instruction;
import com.ippcode.analyzer.model.ProgramStatistics;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Counters of a single analysis run.
 * <p>
 * A jump whose target is already declared is counted as backward right away.
 * Other targets wait in a pending list until {@link #resolve()}, when the full
 * label set is known and each of them is either forward or unresolvable.
 */
public class StatisticsEngine {

    private final Set<String> declaredLabels = new HashSet<>();
    private final List<String> pendingTargets = new ArrayList<>();
    private final Map<String, Integer> opcodeFrequencies = new TreeMap<>();

    private int linesOfCode;
    private int comments;
    private int duplicateLabels;
    private int jumps;
    private int backwardJumps;
    private ProgramStatistics resolved;

    public void recordComments(int commentLines) {
        ensureOpen();
        comments += commentLines;
    }

    public void observe(Instruction instruction) {
        ensureOpen();
        GrammarEntry entry = GrammarTable.lookup(instruction.opcode())
            .orElseThrow(() -> new IllegalArgumentException("Unknown opcode " + instruction.opcode()));

        linesOfCode++;
        opcodeFrequencies.merge(instruction.opcode(), 1, Integer::sum);

        if (entry.isLabelDeclaration()) {
            String label = instruction.operand(0).value();
            if (!declaredLabels.add(label)) {
                duplicateLabels++;
            }
        } else if (entry.isJump()) {
            jumps++;
            String target = instruction.operand(0).value();
            if (declaredLabels.contains(target)) {
                backwardJumps++;
            } else {
                pendingTargets.add(target);
            }
        }
    }

    /**
     * Classifies the pending jump targets and freezes the counters. Further
     * calls return the same snapshot.
     */
    public ProgramStatistics resolve() {
        if (resolved != null) {
            return resolved;
        }

        int forwardJumps = 0;
        int unresolvableJumps = 0;
        for (String target : pendingTargets) {
            if (declaredLabels.contains(target)) {
                forwardJumps++;
            } else {
                unresolvableJumps++;
            }
        }

        resolved = new ProgramStatistics(
                linesOfCode,
                comments,
                declaredLabels.size(),
                duplicateLabels,
                jumps,
                backwardJumps,
                forwardJumps,
                unresolvableJumps,
                opcodeFrequencies);
        return resolved;
    }

    public List<String> pendingTargets() {
        return List.copyOf(pendingTargets);
    }

    private void ensureOpen() {
        if (resolved != null) {
            throw new IllegalStateException("Statistics already resolved");
        }
    }
}
