package com.abcft.pdfedit.core.content;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Text shown between one {@code BT} and its {@code ET}.
 */
public final class ParsedTextBlock {

    private final int index;
    private final int beginTokenIndex;
    private final boolean recovered;
    private final List<TextShowOperation> operations = new ArrayList<>();
    private int endTokenIndex = -1;

    ParsedTextBlock(int index, int beginTokenIndex, boolean recovered) {
        this.index = index;
        this.beginTokenIndex = beginTokenIndex;
        this.recovered = recovered;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Token index of the {@code BT}, or the first show operator of a recovered block.
     */
    public int getBeginTokenIndex() {
        return beginTokenIndex;
    }

    /**
     * Token index of the {@code ET}, or -1 if the block was closed by the end of the stream.
     */
    public int getEndTokenIndex() {
        return endTokenIndex;
    }

    void close(int endTokenIndex) {
        this.endTokenIndex = endTokenIndex;
    }

    /**
     * Whether the block was opened for text shown outside {@code BT}/{@code ET}.
     */
    public boolean isRecovered() {
        return recovered;
    }

    void add(TextShowOperation operation) {
        operations.add(operation);
    }

    public List<TextShowOperation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public String getText() {
        return operations.stream().map(TextShowOperation::getText).collect(Collectors.joining());
    }

    @Override
    public String toString() {
        return "ParsedTextBlock#" + index + "[" + getText() + "]";
    }
}
