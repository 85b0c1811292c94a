package infra.director.services;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class ReadOnlyQueryValidatorTest {

    @Test
    @DisplayName("Plain reads are accepted")
    void acceptsReads() {
        Assertions.assertTrue(ReadOnlyQueryValidator.isReadOnly("SELECT * FROM orders WHERE id = ?"));
        Assertions.assertTrue(ReadOnlyQueryValidator.isReadOnly("  with recent as (select 1) select * from recent"));
        Assertions.assertTrue(ReadOnlyQueryValidator.isReadOnly("SHOW TABLES"));
        Assertions.assertTrue(ReadOnlyQueryValidator.isReadOnly("EXPLAIN SELECT 1"));
    }

    @Test
    @DisplayName("Leading write keywords are rejected case-insensitively")
    void rejectsLeadingWrites() {
        ReadOnlyViolationException e = Assertions.assertThrows(ReadOnlyViolationException.class,
            () -> ReadOnlyQueryValidator.validate("delete from orders"));
        Assertions.assertEquals("DELETE", e.getDetected());
        Assertions.assertFalse(ReadOnlyQueryValidator.isReadOnly("  Truncate orders"));
        Assertions.assertFalse(ReadOnlyQueryValidator.isReadOnly("CALL refresh_stats()"));
    }

    @Test
    @DisplayName("Chained statements are rejected")
    void rejectsChainedWrites() {
        Assertions.assertFalse(ReadOnlyQueryValidator.isReadOnly("SELECT 1;DROP TABLE orders"));
        Assertions.assertFalse(ReadOnlyQueryValidator.isReadOnly("SELECT 1; UPDATE orders SET x = 1"));
    }

    @Test
    @DisplayName("SELECT INTO and file exports are rejected")
    void rejectsInto() {
        Assertions.assertFalse(ReadOnlyQueryValidator.isReadOnly("SELECT * INTO backup FROM orders"));
        Assertions.assertFalse(ReadOnlyQueryValidator.isReadOnly("SELECT * FROM orders INTO OUTFILE '/tmp/x'"));
    }

    @Test
    @DisplayName("Null and empty queries pass the write check")
    void emptyQueries() {
        Assertions.assertTrue(ReadOnlyQueryValidator.isReadOnly(null));
        Assertions.assertTrue(ReadOnlyQueryValidator.isReadOnly(""));
    }
}
