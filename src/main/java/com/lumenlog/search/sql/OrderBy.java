package com.lumenlog.search.sql;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One ORDER BY item: a field (or expression text) and its direction
 */
public class OrderBy {

    private final String field;
    private final OrderDirection direction;

    @JsonCreator
    public OrderBy(@JsonProperty("field") String field,
                   @JsonProperty("direction") OrderDirection direction) {
        this.field = field;
        this.direction = direction;
    }

    public String getField() {
        return field;
    }

    public OrderDirection getDirection() {
        return direction;
    }

    @JsonIgnore
    public boolean isDescending() {
        return direction == OrderDirection.DESC;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderBy that = (OrderBy) o;
        return field.equals(that.field) && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, direction);
    }

    @Override
    public String toString() {
        return field + " " + direction;
    }
}
