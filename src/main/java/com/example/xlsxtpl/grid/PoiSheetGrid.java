package com.example.xlsxtpl.grid;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFRow;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Date;
import java.util.List;

/**
 * {@link Grid} over an Apache POI sheet.
 *
 * Rows and cells are moved one by one instead of through {@code Sheet.shiftRows} /
 * {@code Sheet.shiftColumns}, so a row shift never rewrites column positions
 * and the other way round. Merged regions, formulas and conditional formats are
 * not adjusted.
 */
public class PoiSheetGrid implements Grid {

    private final Sheet sheet;

    public PoiSheetGrid(Sheet sheet) {
        this.sheet = sheet;
    }

    @Override
    public int getMaxRow() {
        return lastRowIndex() + 1;
    }

    @Override
    public int getMaxColumn() {
        int max = 0;
        for (Row row : sheet) {
            max = Math.max(max, row.getLastCellNum());
        }
        return max;
    }

    @Override
    public Object getValue(int row, int column) {
        Cell cell = cellAt(row - 1, column - 1);
        if (cell == null) {
            return null;
        }
        switch (cell.getCellType()) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                return cell.getNumericCellValue();
            case BOOLEAN:
                return cell.getBooleanCellValue();
            case FORMULA:
                return "=" + cell.getCellFormula();
            default:
                return null;
        }
    }

    @Override
    public void setValue(int row, int column, Object value) {
        Row target = sheet.getRow(row - 1);
        if (target == null) {
            if (value == null) {
                return;
            }
            target = sheet.createRow(row - 1);
        }
        Cell cell = target.getCell(column - 1);
        if (cell == null) {
            if (value == null) {
                return;
            }
            cell = target.createCell(column - 1);
        }

        if (value == null) {
            cell.setBlank();
        } else if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            cell.setCellValue((Boolean) value);
        } else if (value instanceof LocalDateTime) {
            cell.setCellValue((LocalDateTime) value);
        } else if (value instanceof LocalDate) {
            cell.setCellValue((LocalDate) value);
        } else if (value instanceof Date) {
            cell.setCellValue((Date) value);
        } else if (value instanceof Calendar) {
            cell.setCellValue((Calendar) value);
        } else {
            cell.setCellValue(value.toString());
        }
    }

    @Override
    public void insertRows(int at, int count) {
        if (count <= 0) {
            return;
        }
        for (int r = lastRowIndex(); r >= at - 1; r--) {
            moveRow(r, r + count);
        }
    }

    @Override
    public void deleteRows(int at, int count) {
        if (count <= 0) {
            return;
        }
        int first = at - 1;
        int end = first + count;
        int last = lastRowIndex();
        for (int r = first; r < end; r++) {
            Row row = sheet.getRow(r);
            if (row != null) {
                sheet.removeRow(row);
            }
        }
        for (int r = end; r <= last; r++) {
            moveRow(r, r - count);
        }
    }

    @Override
    public void insertColumns(int at, int count) {
        if (count <= 0) {
            return;
        }
        int first = at - 1;
        int maxColumn = getMaxColumn();
        for (Row row : rows()) {
            for (int c = row.getLastCellNum() - 1; c >= first; c--) {
                moveCell(row, c, c + count);
            }
        }
        for (int c = maxColumn - 1; c >= first; c--) {
            copyColumnMetadataIndex(c, c + count);
        }
        for (int c = first; c < Math.min(first + count, maxColumn); c++) {
            resetColumnMetadata(c);
        }
    }

    @Override
    public void deleteColumns(int at, int count) {
        if (count <= 0) {
            return;
        }
        int first = at - 1;
        int end = first + count;
        int maxColumn = getMaxColumn();
        for (Row row : rows()) {
            int lastCell = row.getLastCellNum();
            for (int c = first; c < end; c++) {
                Cell cell = row.getCell(c);
                if (cell != null) {
                    row.removeCell(cell);
                }
            }
            for (int c = end; c < lastCell; c++) {
                moveCell(row, c, c - count);
            }
        }
        for (int c = first; c + count < maxColumn; c++) {
            copyColumnMetadataIndex(c + count, c);
        }
        for (int c = Math.max(first, maxColumn - count); c < maxColumn; c++) {
            resetColumnMetadata(c);
        }
    }

    @Override
    public void copyRowMetadata(int sourceRow, int targetRow) {
        Row source = sheet.getRow(sourceRow - 1);
        if (source == null) {
            return;
        }
        Row target = sheet.getRow(targetRow - 1);
        if (target == null) {
            target = sheet.createRow(targetRow - 1);
        }
        copyRowMetadata(source, target);
    }

    @Override
    public void copyColumnMetadata(int sourceColumn, int targetColumn) {
        copyColumnMetadataIndex(sourceColumn - 1, targetColumn - 1);
    }

    @Override
    public void copyCell(int sourceRow, int sourceColumn, int targetRow, int targetColumn) {
        Cell source = cellAt(sourceRow - 1, sourceColumn - 1);
        Row row = sheet.getRow(targetRow - 1);
        if (source == null) {
            if (row != null) {
                Cell existing = row.getCell(targetColumn - 1);
                if (existing != null) {
                    row.removeCell(existing);
                }
            }
            return;
        }
        if (row == null) {
            row = sheet.createRow(targetRow - 1);
        }
        Cell target = row.getCell(targetColumn - 1);
        if (target == null) {
            target = row.createCell(targetColumn - 1);
        }
        copyCellContent(source, target);
    }

    private Cell cellAt(int rowIndex, int columnIndex) {
        if (rowIndex < 0 || columnIndex < 0) {
            return null;
        }
        Row row = sheet.getRow(rowIndex);
        return row == null ? null : row.getCell(columnIndex);
    }

    private int lastRowIndex() {
        return sheet.getPhysicalNumberOfRows() == 0 ? -1 : sheet.getLastRowNum();
    }

    // snapshot so cell moves never run against a live row iterator
    private List<Row> rows() {
        List<Row> rows = new ArrayList<>();
        for (Row row : sheet) {
            rows.add(row);
        }
        return rows;
    }

    private void moveRow(int from, int to) {
        Row source = sheet.getRow(from);
        Row existing = sheet.getRow(to);
        if (existing != null) {
            sheet.removeRow(existing);
        }
        if (source == null) {
            return;
        }
        Row target = sheet.createRow(to);
        copyRowMetadata(source, target);
        for (Cell cell : source) {
            copyCellContent(cell, target.createCell(cell.getColumnIndex()));
        }
        sheet.removeRow(source);
    }

    private void moveCell(Row row, int from, int to) {
        Cell source = row.getCell(from);
        Cell existing = row.getCell(to);
        if (existing != null) {
            row.removeCell(existing);
        }
        if (source == null) {
            return;
        }
        copyCellContent(source, row.createCell(to));
        row.removeCell(source);
    }

    private void copyRowMetadata(Row source, Row target) {
        if (source.getHeight() == sheet.getDefaultRowHeight()) {
            target.setHeight((short) -1);
        } else {
            target.setHeight(source.getHeight());
        }
        target.setZeroHeight(source.getZeroHeight());
        if (source.isFormatted() && source.getRowStyle() != null) {
            target.setRowStyle(source.getRowStyle());
        }
        if (target instanceof XSSFRow) {
            ((XSSFRow) target).getCTRow().setOutlineLevel((short) source.getOutlineLevel());
        }
    }

    private void copyColumnMetadataIndex(int from, int to) {
        sheet.setColumnWidth(to, sheet.getColumnWidth(from));
        sheet.setColumnHidden(to, sheet.isColumnHidden(from));
    }

    private void resetColumnMetadata(int column) {
        sheet.setColumnWidth(column, sheet.getDefaultColumnWidth() * 256);
        sheet.setColumnHidden(column, false);
    }

    private static void copyCellContent(Cell source, Cell target) {
        target.setCellStyle(source.getCellStyle());
        CellType type = source.getCellType();
        switch (type) {
            case STRING:
                target.setCellValue(source.getRichStringCellValue());
                break;
            case NUMERIC:
                target.setCellValue(source.getNumericCellValue());
                break;
            case BOOLEAN:
                target.setCellValue(source.getBooleanCellValue());
                break;
            case FORMULA:
                target.setCellFormula(source.getCellFormula());
                break;
            case ERROR:
                target.setCellErrorValue(source.getErrorCellValue());
                break;
            default:
                target.setBlank();
                break;
        }
    }
}
