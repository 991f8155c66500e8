package com.kpi.drivertree.service;

import com.kpi.drivertree.config.DriverTreeProperties;
import com.kpi.drivertree.entity.DriverTree;
import com.kpi.drivertree.entity.DriverTreeNode;
import com.kpi.drivertree.exception.FormulaValidationException;
import com.kpi.drivertree.exception.TreeConsistencyException;
import com.kpi.drivertree.store.DecompositionStore;
import com.kpi.drivertree.store.NodeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a batch of formulas into decomposition records over shared, label-deduplicated nodes.
 * <p>
 * The whole batch is parsed, validated and checked for cycles before anything is written,
 * so a bad formula is reported by its input position with the store untouched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TreeBuilder {

    private final ExpressionParser expressionParser;
    private final NodeStore nodeStore;
    private final DecompositionStore decompositionStore;
    private final DriverTreeProperties properties;

    /**
     * Builds the forest for a batch of formulas.
     * @param formulas e.g. ["profit = revenue - cost", "revenue = quantity * price"]
     * @throws FormulaValidationException if the batch is empty or a label is unusable
     * @throws com.kpi.drivertree.exception.FormulaParseException if a formula cannot be split
     * @throws TreeConsistencyException if the formulas reference each other in a cycle
     */
    public TreeBuildResult build(List<String> formulas) {
        if (formulas == null || formulas.isEmpty()) {
            throw new FormulaValidationException("No formulas given");
        }

        List<ParsedFormula> parsed = parseAll(formulas);

        NodeRegistry registry = new NodeRegistry(nodeStore);
        Map<String, DriverTree> forest = new LinkedHashMap<>();
        List<DriverTree> decompositions = new ArrayList<>(parsed.size());

        for (ParsedFormula formula : parsed) {
            DriverTree tree = createDecomposition(formula, registry);
            decompositions.add(tree);

            DriverTree previous = forest.put(formula.getRootLabel(), tree);
            if (previous != null) {
                // Last formula wins: the earlier record stays persisted but leaves the result.
                log.warn("Formula #{} redefines '{}', replacing the earlier decomposition (ID: {})",
                        formula.getIndex(), formula.getRootLabel(), previous.getId());
            }
        }

        log.info("Built {} decompositions over {} nodes ({} created, {} reused)",
                decompositions.size(), registry.size(), registry.createdCount(), registry.adoptedCount());

        return TreeBuildResult.builder()
                .forest(forest)
                .decompositions(decompositions)
                .layoutRoots(layoutRoots(parsed, forest))
                .registry(registry)
                .build();
    }

    /**
     * Parses, validates and cycle-checks each formula in input order, so the first offending
     * formula is the one reported whatever its kind of error.
     */
    private List<ParsedFormula> parseAll(List<String> formulas) {
        int labelLimit = Math.min(properties.getMaxLabelLength(), DriverTreeNode.MAX_LABEL_LENGTH);
        Map<String, Set<String>> dependencies = new HashMap<>();
        List<ParsedFormula> parsed = new ArrayList<>(formulas.size());
        for (int i = 0; i < formulas.size(); i++) {
            String formula = formulas.get(i);
            ParsedFormula result;
            try {
                result = expressionParser.parseFormula(formula, i);
            } catch (FormulaValidationException e) {
                throw new FormulaValidationException(e.getMessage(), formula, i);
            }
            validateLabel(result.getRootLabel(), "Root label", result, labelLimit);
            for (String operand : result.getExpression().getOperands()) {
                validateLabel(operand, "Operand", result, labelLimit);
            }
            addDependencies(result, dependencies);
            parsed.add(result);
        }
        return parsed;
    }

    private void validateLabel(String label, String role, ParsedFormula formula, int labelLimit) {
        if (label == null || label.isEmpty()) {
            throw new FormulaValidationException(role + " must not be empty",
                    formula.getFormula(), formula.getIndex());
        }
        if (label.length() > labelLimit) {
            throw new FormulaValidationException(
                    String.format("%s '%s' exceeds %d characters", role, label, labelLimit),
                    formula.getFormula(), formula.getIndex());
        }
    }

    /**
     * Records the root -> operand edges of a formula, rejecting it if one of them closes a cycle.
     * Every formula contributes edges, including a root defined again later, since every
     * decomposition record is stored.
     */
    private void addDependencies(ParsedFormula formula, Map<String, Set<String>> dependencies) {
        String root = formula.getRootLabel();
        List<String> operands = formula.getExpression().getOperands();
        for (String operand : operands) {
            if (reaches(operand, root, dependencies)) {
                throw new TreeConsistencyException(
                        String.format("Cycle detected: '%s' depends on '%s'", root, operand),
                        formula.getFormula(), formula.getIndex());
            }
        }
        dependencies.computeIfAbsent(root, k -> new LinkedHashSet<>()).addAll(operands);
    }

    private boolean reaches(String from, String target, Map<String, Set<String>> dependencies) {
        Deque<String> pending = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        pending.push(from);
        while (!pending.isEmpty()) {
            String label = pending.pop();
            if (label.equals(target)) {
                return true;
            }
            if (seen.add(label)) {
                pending.addAll(dependencies.getOrDefault(label, Set.of()));
            }
        }
        return false;
    }

    private DriverTree createDecomposition(ParsedFormula formula, NodeRegistry registry) {
        try {
            DriverTreeNode root = registry.findOrCreate(formula.getRootLabel());
            List<DriverTreeNode> children = new ArrayList<>();
            for (String operand : formula.getExpression().getOperands()) {
                children.add(registry.findOrCreate(operand));
            }

            DriverTree tree = decompositionStore.create(root, formula.getExpression().getOperator(), children);
            log.debug("Formula #{} -> decomposition of '{}' with {} children",
                    formula.getIndex(), formula.getRootLabel(), children.size());
            return tree;
        } catch (TreeConsistencyException e) {
            if (e.hasFormula()) {
                throw e;
            }
            throw new TreeConsistencyException(e.getMessage(), formula.getFormula(), formula.getIndex(), e);
        } catch (FormulaValidationException e) {
            if (e.hasFormula()) {
                throw e;
            }
            throw new FormulaValidationException(e.getMessage(), formula.getFormula(), formula.getIndex(), e);
        }
    }

    private List<DriverTreeNode> layoutRoots(List<ParsedFormula> parsed, Map<String, DriverTree> forest) {
        Set<String> operands = new HashSet<>();
        for (ParsedFormula formula : parsed) {
            operands.addAll(formula.getExpression().getOperands());
        }

        List<DriverTreeNode> topLevel = new ArrayList<>();
        List<DriverTreeNode> nested = new ArrayList<>();
        for (Map.Entry<String, DriverTree> entry : forest.entrySet()) {
            if (operands.contains(entry.getKey())) {
                nested.add(entry.getValue().getRootNode());
            } else {
                topLevel.add(entry.getValue().getRootNode());
            }
        }
        topLevel.addAll(nested);
        return topLevel;
    }
}
