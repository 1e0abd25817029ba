package com.libragraph.depot.core.query;

import com.libragraph.depot.types.FileField;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WhereParserTest {

    @Test
    void emptyDocumentMatchesAll() {
        assertThat(WhereParser.parse(null)).isInstanceOf(Filter.All.class);
        assertThat(WhereParser.parse(Map.of())).isInstanceOf(Filter.All.class);
    }

    @Test
    void plainValueMeansEquality() {
        Filter f = WhereParser.parse(Map.of("filename", "a.txt"));

        assertThat(f).isEqualTo(new Filter.Comparison(FieldRef.of(FileField.FILENAME), Operator.EQ, "a.txt"));
    }

    @Test
    void operatorObjectOnAliasedField() {
        Filter f = WhereParser.parse(Map.of("uploadDate", Map.of("gte", "2024-01-01T00:00:00Z")));

        assertThat(f).isEqualTo(new Filter.Comparison(
                FieldRef.of(FileField.UPLOADED_AT), Operator.GTE, "2024-01-01T00:00:00Z"));
    }

    @Test
    void setOperatorsTakeLists() {
        Filter f = WhereParser.parse(Map.of("metadata.tag", Map.of("inq", List.of("x", "y"))));

        assertThat(f).isEqualTo(new Filter.Comparison(FieldRef.metadata("tag"), Operator.IN, List.of("x", "y")));
    }

    @Test
    void multipleKeysAreConjoined() {
        Map<String, Object> where = new LinkedHashMap<>();
        where.put("filename", "a.txt");
        where.put("metadata.author", Map.of("neq", "bob"));

        Filter f = WhereParser.parse(where);

        assertThat(f).isInstanceOf(Filter.And.class);
        assertThat(((Filter.And) f).filters()).containsExactly(
                new Filter.Comparison(FieldRef.of(FileField.FILENAME), Operator.EQ, "a.txt"),
                new Filter.Comparison(FieldRef.metadata("author"), Operator.NE, "bob"));
    }

    @Test
    void orTakesListOfDocuments() {
        Filter f = WhereParser.parse(Map.of("or", List.of(
                Map.of("filename", "a"), Map.of("filename", "b"))));

        assertThat(f).isInstanceOf(Filter.Or.class);
        assertThat(((Filter.Or) f).filters()).hasSize(2);
    }

    @Test
    void emptyOrMatchesNothing() {
        Filter f = WhereParser.parse(Map.of("or", List.of()));

        assertThat(f).isEqualTo(new Filter.Or(List.of()));
    }

    @Test
    void rangeOnOneFieldIsConjoined() {
        Map<String, Object> range = new LinkedHashMap<>();
        range.put("gt", 1);
        range.put("lt", 5);

        Filter f = WhereParser.parse(Map.of("length", range));

        assertThat(((Filter.And) f).filters()).extracting(c -> ((Filter.Comparison) c).operator())
                .containsExactly(Operator.GT, Operator.LT);
    }

    @Test
    void unknownOperatorIsRejected() {
        assertThatThrownBy(() -> WhereParser.parse(Map.of("filename", Map.of("like", "a%"))))
                .isInstanceOf(InvalidFilterException.class)
                .hasMessageContaining("like");
    }

    @Test
    void unknownFieldIsRejected() {
        assertThatThrownBy(() -> WhereParser.parse(Map.of("size", 1)))
                .isInstanceOf(InvalidFilterException.class)
                .hasMessageContaining("size");
    }

    @Test
    void malformedBooleanListIsRejected() {
        assertThatThrownBy(() -> WhereParser.parse(Map.of("and", "filename")))
                .isInstanceOf(InvalidFilterException.class);
        assertThatThrownBy(() -> WhereParser.parse(Map.of("or", List.of("filename"))))
                .isInstanceOf(InvalidFilterException.class);
    }

    @Test
    void setOperatorWithoutListIsRejected() {
        assertThatThrownBy(() -> WhereParser.parse(Map.of("filename", Map.of("nin", "a"))))
                .isInstanceOf(InvalidFilterException.class);
    }
}
