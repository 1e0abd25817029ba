package com.libragraph.depot.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.depot.core.query.FieldRef;
import com.libragraph.depot.core.query.Filter;
import com.libragraph.depot.core.query.InvalidFilterException;
import com.libragraph.depot.core.query.Operator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestJsonTest {

    private final RequestJson json = new RequestJson(new ObjectMapper());

    @Test
    void absentWhereMatchesAll() {
        assertThat(json.where(null)).isEqualTo(Filter.all());
        assertThat(json.where("  ")).isEqualTo(Filter.all());
    }

    @Test
    void whereIsParsed() {
        assertThat(json.where("{\"metadata.stage\":\"final\"}"))
                .isEqualTo(Filter.compare(FieldRef.metadata("stage"), Operator.EQ, "final"));
    }

    @Test
    void malformedWhereIsInvalidFilter() {
        assertThatThrownBy(() -> json.where("{not json"))
                .isInstanceOf(InvalidFilterException.class)
                .hasMessageStartingWith("Malformed where parameter");
    }

    @Test
    void metadataHeader() {
        assertThat(json.metadata(null)).isEmpty();
        assertThat(json.metadata("{\"author\":\"ann\",\"pages\":3}"))
                .containsEntry("author", "ann")
                .containsEntry("pages", 3);
        assertThatThrownBy(() -> json.metadata("[1,2]")).isInstanceOf(IllegalArgumentException.class);
    }
}
