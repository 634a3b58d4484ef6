package com.lumenlog.search.sql;

public enum OrderDirection {
    ASC,
    DESC
}
