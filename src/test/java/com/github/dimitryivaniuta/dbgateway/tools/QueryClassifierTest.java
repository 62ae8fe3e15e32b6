package com.github.dimitryivaniuta.dbgateway.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryClassifierTest {

    private final QueryClassifier classifier = new QueryClassifier();

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT * FROM users",
            "select id from users where name = 'DROP TABLE x'",
            "WITH t AS (SELECT 1) SELECT * FROM t",
            "VALUES (1), (2)",
            "EXPLAIN SELECT 1",
            "SELECT 1;",
            "-- leading comment\nSELECT 1",
            "SELECT \"delete\" FROM audit"
    })
    void readOnlyStatementsPass(String sql) {
        assertThat(classifier.isReadOnly(sql)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "DELETE FROM users",
            "update users set name = 'x'",
            "INSERT INTO t VALUES (1)",
            "DROP TABLE users",
            "SELECT 1; DROP TABLE users",
            "WITH d AS (DELETE FROM t RETURNING *) SELECT * FROM d",
            "CALL do_something()",
            "TRUNCATE t",
            "SELECT * INTO new_table FROM t /* */; CREATE TABLE x(id int)",
            "GRANT ALL ON t TO bob"
    })
    void writesAndMultipleStatementsAreRejected(String sql) {
        assertThat(classifier.isReadOnly(sql)).isFalse();
        assertThatThrownBy(() -> classifier.requireReadOnly(sql))
                .isInstanceOf(ReadOnlyViolationException.class);
    }

    @Test
    void blankSqlIsRejected() {
        assertThatThrownBy(() -> classifier.requireReadOnly("  "))
                .isInstanceOf(ReadOnlyViolationException.class)
                .hasMessageContaining("blank");
        assertThatThrownBy(() -> classifier.requireReadOnly("-- only a comment"))
                .isInstanceOf(ReadOnlyViolationException.class);
    }

    @Test
    void writeKeywordIsNamedInTheMessage() {
        assertThatThrownBy(() -> classifier.requireReadOnly("WITH x AS (UPDATE t SET a = 1) SELECT 1"))
                .hasMessageContaining("UPDATE");
    }

    @Test
    void volatileFunctionsAreNotCacheable() {
        assertThat(classifier.isCacheable("SELECT id, name FROM users ORDER BY id")).isTrue();
        assertThat(classifier.isCacheable("SELECT now()")).isFalse();
        assertThat(classifier.isCacheable("SELECT * FROM t WHERE r < random()")).isFalse();
        assertThat(classifier.isCacheable("SELECT nextval('seq')")).isFalse();
        assertThat(classifier.isCacheable("SELECT 'now' AS word")).isTrue();
        assertThat(classifier.isCacheable("DELETE FROM t")).isFalse();
    }

    @Test
    void literalsAndCommentsAreBlanked() {
        assertThat(QueryClassifier.blankLiteralsAndComments("SELECT 'a;b' -- x;y"))
                .isEqualTo("SELECT '   '  ");
        assertThat(QueryClassifier.blankLiteralsAndComments("SELECT 'it''s' /* c */ 1"))
                .isEqualTo("SELECT '     '   1");
    }
}
