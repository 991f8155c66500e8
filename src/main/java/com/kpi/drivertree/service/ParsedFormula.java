package com.kpi.drivertree.service;

import lombok.Builder;
import lombok.Data;

/**
 * One formula of a batch after parsing, with its position in the submitted list.
 */
@Data
@Builder
public class ParsedFormula {
    private final int index;
    private final String formula;
    private final String rootLabel;
    private final ParsedExpression expression;
}
