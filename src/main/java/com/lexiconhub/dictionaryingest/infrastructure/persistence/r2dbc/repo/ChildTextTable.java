package com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.repo;

/**
 * 텍스트 한 컬럼만 가진 하위 테이블(staging / production) 쌍.
 */
public enum ChildTextTable {

    ALIAS("parsed_alias_staging", "parsed_definition_alias", "alias"),
    SYNONYM("parsed_synonym_staging", "parsed_definition_synonym", "synonym"),
    EXAMPLE("parsed_example_staging", "parsed_definition_example", "example");

    private final String stagingTable;
    private final String productionTable;
    private final String column;

    ChildTextTable(String stagingTable, String productionTable, String column) {
        this.stagingTable = stagingTable;
        this.productionTable = productionTable;
        this.column = column;
    }

    public String stagingTable() { return stagingTable; }
    public String productionTable() { return productionTable; }
    public String column() { return column; }
}
