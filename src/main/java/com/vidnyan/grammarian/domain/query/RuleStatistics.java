package com.vidnyan.grammarian.domain.query;

/**
 * @param fanOut       distinct names the rule references
 * @param fanIn        other rules referencing it
 * @param alternatives top-level alternatives, a rough complexity measure
 */
public record RuleStatistics(
    String name,
    String kind,
    boolean fragment,
    int lineNumber,
    int fanOut,
    int fanIn,
    int alternatives,
    boolean recursive
) {}
