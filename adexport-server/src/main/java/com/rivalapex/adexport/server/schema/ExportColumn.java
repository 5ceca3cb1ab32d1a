package com.rivalapex.adexport.server.schema;

import lombok.Value;

@Value
public class ExportColumn {

    String name;

    ColumnType type;
}
