package com.gridcalc.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO representation of a persisted sheet.
 *
 * <pre>
 * {
 *   "cells": [[0, 0, {"value": "1", "formula": null}], [0, 1, {"value": "2", "formula": "=A1+1"}]],
 *   "rows": 100,
 *   "cols": 26,
 *   "column_widths": {"1": 12},
 *   "default_column_width": 8
 * }
 * </pre>
 *
 * Dependency edges are never persisted.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SheetDocument {
    private List<CellEntry> cells = new ArrayList<>();
    private int rows = 100;
    private int cols = 26;
    @JsonProperty("column_widths")
    private Map<Integer, Integer> columnWidths = new TreeMap<>();
    @JsonProperty("default_column_width")
    private int defaultColumnWidth = 8;

    /** One populated cell, written as a {@code [row, col, content]} triple. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({ "row", "col", "content" })
    public static final class CellEntry {
        private int row;
        private int col;
        private CellContent content;
    }

    /** Display value plus formula text (null for literals). */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CellContent {
        private String value;
        private String formula;
    }
}
