package com.profitrate.reconciliation.source;

import com.profitrate.reconciliation.config.ConfigurationException;
import com.profitrate.reconciliation.core.model.Unit;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Declares where a source lives and how to extract one variable from it.
 * The native unit is mandatory; it is never inferred from the data.
 */
public final class SourceDescriptor {
    private final String sourceId;
    private final String variableId;
    private final Path path;
    private final Unit nativeUnit;
    private final SourceLayout layout;
    private final String rowLabel;
    private final int labelColumn;
    private final int firstYearColumn;
    private final String yearColumn;
    private final String variableColumn;
    private final String valueColumn;

    private SourceDescriptor(Builder builder) {
        this.sourceId = builder.sourceId;
        this.variableId = builder.variableId;
        this.path = builder.path;
        this.nativeUnit = builder.nativeUnit;
        this.layout = builder.layout;
        this.rowLabel = builder.rowLabel != null ? builder.rowLabel : builder.variableId;
        this.labelColumn = builder.labelColumn;
        this.firstYearColumn = builder.firstYearColumn;
        this.yearColumn = builder.yearColumn;
        this.variableColumn = builder.variableColumn;
        this.valueColumn = builder.valueColumn;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getVariableId() {
        return variableId;
    }

    public Path getPath() {
        return path;
    }

    public Unit getNativeUnit() {
        return nativeUnit;
    }

    public SourceLayout getLayout() {
        return layout;
    }

    /**
     * Label identifying the variable inside the file (row label or variable column value).
     */
    public String getRowLabel() {
        return rowLabel;
    }

    public int getLabelColumn() {
        return labelColumn;
    }

    public int getFirstYearColumn() {
        return firstYearColumn;
    }

    public String getYearColumn() {
        return yearColumn;
    }

    public String getVariableColumn() {
        return variableColumn;
    }

    public String getValueColumn() {
        return valueColumn;
    }

    @Override
    public String toString() {
        return "SourceDescriptor{source=" + sourceId + ", variable=" + variableId
                + ", path=" + path + ", unit=" + nativeUnit + ", layout=" + layout.wireName() + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sourceId;
        private String variableId;
        private Path path;
        private Unit nativeUnit;
        private SourceLayout layout = SourceLayout.WIDE;
        private String rowLabel;
        private int labelColumn = 0;
        private int firstYearColumn = 1;
        private String yearColumn = "year";
        private String variableColumn = "variable";
        private String valueColumn = "value";

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder variableId(String variableId) {
            this.variableId = variableId;
            return this;
        }

        public Builder path(Path path) {
            this.path = path;
            return this;
        }

        public Builder nativeUnit(Unit nativeUnit) {
            this.nativeUnit = nativeUnit;
            return this;
        }

        public Builder layout(SourceLayout layout) {
            this.layout = layout;
            return this;
        }

        public Builder rowLabel(String rowLabel) {
            this.rowLabel = rowLabel;
            return this;
        }

        public Builder labelColumn(int labelColumn) {
            this.labelColumn = labelColumn;
            return this;
        }

        public Builder firstYearColumn(int firstYearColumn) {
            this.firstYearColumn = firstYearColumn;
            return this;
        }

        public Builder yearColumn(String yearColumn) {
            this.yearColumn = yearColumn;
            return this;
        }

        public Builder variableColumn(String variableColumn) {
            this.variableColumn = variableColumn;
            return this;
        }

        public Builder valueColumn(String valueColumn) {
            this.valueColumn = valueColumn;
            return this;
        }

        public SourceDescriptor build() {
            Objects.requireNonNull(sourceId, "sourceId is required");
            Objects.requireNonNull(variableId, "variableId is required");
            Objects.requireNonNull(path, "path is required");
            Objects.requireNonNull(layout, "layout is required");
            if (nativeUnit == null) {
                throw new ConfigurationException("sources[" + sourceId + "/" + variableId + "].unit",
                        "no native unit declared");
            }
            if (labelColumn < 0 || firstYearColumn < 0) {
                throw new ConfigurationException("sources[" + sourceId + "/" + variableId + "]",
                        "column indexes must be >= 0");
            }
            return new SourceDescriptor(this);
        }
    }
}
