package com.raditha.extract.model;

/**
 * How one variable is used by a selection.
 *
 * @param name                    variable name
 * @param inferredType            declared, resolved or guessed type
 * @param declaredInSelection     declared inside the selected lines
 * @param declaredBeforeSelection declared earlier in the enclosing function, or a parameter of it
 * @param usedAfterSelection      referenced after the selection within the enclosing function
 * @param isModified              assigned, incremented or decremented inside the selection
 * @param isRead                  read inside the selection
 * @param usageCount              number of references inside the selection (declarations excluded)
 * @param firstSeenLine           first line inside the selection mentioning the variable
 */
public record VariableUsage(
        String name,
        String inferredType,
        boolean declaredInSelection,
        boolean declaredBeforeSelection,
        boolean usedAfterSelection,
        boolean isModified,
        boolean isRead,
        int usageCount,
        int firstSeenLine) {

    public VariableScope scope() {
        if (declaredInSelection) {
            return VariableScope.LOCAL;
        }
        if (declaredBeforeSelection) {
            return VariableScope.FLOW_IN;
        }
        return VariableScope.EXTERNAL;
    }

    /**
     * Read or written inside the selection while declared before it.
     */
    public boolean isFlowIn() {
        return scope() == VariableScope.FLOW_IN && (isRead || isModified);
    }

    /**
     * Declared inside the selection and needed by the code that follows.
     */
    public boolean isFlowOut() {
        return declaredInSelection && usedAfterSelection;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Mutable accumulator used by the analyzers while they scan a selection.
     */
    public static final class Builder {
        private final String name;
        private String inferredType;
        private boolean declaredInSelection;
        private boolean declaredBeforeSelection;
        private boolean usedAfterSelection;
        private boolean modified;
        private boolean read;
        private int usageCount;
        private int firstSeenLine = Integer.MAX_VALUE;

        private Builder(String name) {
            this.name = name;
        }

        public String name() {
            return name;
        }

        public String inferredType() {
            return inferredType;
        }

        public Builder inferredType(String type) {
            this.inferredType = type;
            return this;
        }

        public boolean declaredInSelection() {
            return declaredInSelection;
        }

        public Builder declaredInSelection(boolean value) {
            this.declaredInSelection = value;
            return this;
        }

        public boolean declaredBeforeSelection() {
            return declaredBeforeSelection;
        }

        public Builder declaredBeforeSelection(boolean value) {
            this.declaredBeforeSelection = value;
            return this;
        }

        public Builder usedAfterSelection(boolean value) {
            this.usedAfterSelection = value;
            return this;
        }

        public Builder markModified() {
            this.modified = true;
            return this;
        }

        public Builder markRead() {
            this.read = true;
            return this;
        }

        public Builder countUsage(int line) {
            usageCount++;
            seenAt(line);
            return this;
        }

        public Builder seenAt(int line) {
            firstSeenLine = Math.min(firstSeenLine, line);
            return this;
        }

        /**
         * Fold in another binding of the same name, such as a variable declared again in a sibling block.
         */
        public Builder merge(Builder other) {
            modified |= other.modified;
            read |= other.read;
            usedAfterSelection |= other.usedAfterSelection;
            usageCount += other.usageCount;
            firstSeenLine = Math.min(firstSeenLine, other.firstSeenLine);
            return this;
        }

        public VariableUsage build(String fallbackType) {
            String type = inferredType == null || inferredType.isBlank() ? fallbackType : inferredType;
            int firstLine = firstSeenLine == Integer.MAX_VALUE ? 0 : firstSeenLine;
            return new VariableUsage(name, type, declaredInSelection, declaredBeforeSelection,
                    usedAfterSelection, modified, read, usageCount, firstLine);
        }
    }
}
