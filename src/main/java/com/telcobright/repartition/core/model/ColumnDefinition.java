package com.telcobright.repartition.core.model;

/**
 * Column as discovered from the data dictionary. {@code dataType} is the fully
 * rendered type, e.g. {@code VARCHAR2(100 CHAR)} or {@code bigint unsigned}.
 */
public final class ColumnDefinition {

    private final String name;
    private final String dataType;
    private final boolean nullable;
    private final int position;

    public ColumnDefinition(String name, String dataType, boolean nullable, int position) {
        this.name = Identifiers.requireValid(name, "Column name");
        this.dataType = dataType;
        this.nullable = nullable;
        this.position = position;
    }

    public String getName() { return name; }
    public String getDataType() { return dataType; }
    public boolean isNullable() { return nullable; }
    public int getPosition() { return position; }

    @Override
    public String toString() {
        return name + " " + dataType + (nullable ? "" : " NOT NULL");
    }
}
