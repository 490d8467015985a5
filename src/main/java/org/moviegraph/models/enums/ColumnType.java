package org.moviegraph.models.enums;

public enum ColumnType {
    INTEGER("INT"),
    BIGINT("BIGINT"),
    DOUBLE("DOUBLE PRECISION"),
    DATE("DATE"),
    CODE("CHAR(2)"),
    VARCHAR("VARCHAR"),
    TEXT("TEXT");

    private final String sqlType;

    ColumnType(String sqlType) {
        this.sqlType = sqlType;
    }

    public String sqlType(Integer length) {
        if (this == VARCHAR) {
            return "VARCHAR(" + (length == null ? 255 : length) + ")";
        }
        return sqlType;
    }
}
