package com.abcft.pdfedit.core.content;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Output of {@link ContentStreamParser}.
 */
public final class ParseResult {

    private final List<Object> tokens;
    private final List<TextShowOperation> operations = new ArrayList<>();
    private final List<ParsedTextBlock> blocks = new ArrayList<>();
    private final List<String> anomalies = new ArrayList<>();

    ParseResult(List<Object> tokens) {
        this.tokens = ImmutableList.copyOf(tokens);
    }

    /**
     * The tokens the result was parsed from; operation token indices refer to this list.
     */
    public List<Object> getTokens() {
        return tokens;
    }

    public List<TextShowOperation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    public List<ParsedTextBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public int getAnomalyCount() {
        return anomalies.size();
    }

    public List<String> getAnomalies() {
        return Collections.unmodifiableList(anomalies);
    }

    public boolean hasAnomalies() {
        return !anomalies.isEmpty();
    }

    /**
     * All shown text in stream order.
     */
    public String getText() {
        return operations.stream().map(TextShowOperation::getText).collect(Collectors.joining());
    }

    void addOperation(TextShowOperation operation) {
        operations.add(operation);
    }

    void addBlock(ParsedTextBlock block) {
        blocks.add(block);
    }

    void addAnomaly(String message) {
        anomalies.add(message);
    }

    @Override
    public String toString() {
        return String.format("ParseResult[operations=%d, blocks=%d, anomalies=%d]",
                operations.size(), blocks.size(), anomalies.size());
    }
}
